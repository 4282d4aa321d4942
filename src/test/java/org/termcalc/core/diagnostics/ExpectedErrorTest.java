package org.termcalc.core.diagnostics;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class ExpectedErrorTest {

    @Test
    @Tag("unit")
    void marksPositionBelowInput() {
        assertThat(LocationMarker.mark("3+", 2)).isEqualTo("3+\n  ^~~~");
        assertThat(LocationMarker.mark("abc", -4)).isEqualTo("abc\n^~~~");
    }

    @Test
    @Tag("unit")
    void formatsWithAndWithoutFoundText() {
        ExpectedError withFound = new ExpectedError("pow(5)", "2 argument(s)", "1 argument(s)", 2);
        ExpectedError withoutFound = new ExpectedError("2*(5-3", "symbol \")\"", null, 6);

        assertThat(withFound.format()).isEqualTo("Error: Expected 2 argument(s).\npow(5)\n  ^~~~ Found: 1 argument(s)");
        assertThat(withoutFound.format()).isEqualTo("Error: Expected symbol \")\".\n2*(5-3\n      ^~~~");
        assertThat(withoutFound.foundText()).isEmpty();
    }
}
