package org.termcalc.core.lexer;

import org.termcalc.core.context.MathContext;
import org.termcalc.core.result.NumberType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.NoSuchElementException;

/**
 * Groups the characters of an input line into tokens. The tokenizer works lazily and keeps
 * exactly one token of lookahead, so the classification of a name always reflects the current
 * state of the {@link MathContext}.
 * <p>
 * A lexing failure is stored as the lookahead and thrown by {@link #peek()} and {@link #next()}
 * when the parser reaches it.
 */
public class Tokenizer {

    private static final Logger log = LoggerFactory.getLogger(Tokenizer.class);

    private final MathContext context;
    private final CharStream stream;

    private Token lookahead;
    private TokenException lookaheadError;

    /**
     * Creates a new tokenizer and reads the first token.
     * @param input The input line.
     * @param context The registry used to classify symbols.
     */
    public Tokenizer(String input, MathContext context) {
        this.context = context;
        this.stream = new CharStream(input);
        readNext();
    }

    /**
     * Returns the current token without consuming it.
     * @return The current token.
     * @throws TokenException if the current position holds an unknown character.
     * @throws NoSuchElementException if no token remains.
     */
    public Token peek() throws TokenException {
        if (lookaheadError != null) {
            throw lookaheadError;
        }
        if (lookahead == null) {
            throw new NoSuchElementException("No more tokens in input: " + stream.input());
        }
        return lookahead;
    }

    /**
     * Returns the current token and reads the following one.
     * @return The consumed token.
     * @throws TokenException if the current position holds an unknown character.
     * @throws NoSuchElementException if no token remains.
     */
    public Token next() throws TokenException {
        Token token = peek();
        readNext();
        return token;
    }

    /**
     * @return {@code true} if no token remains. A pending lexing failure counts as a token.
     */
    public boolean eof() {
        return lookahead == null && lookaheadError == null;
    }

    /**
     * @return The offset of the next unread character, which is the input length at the end.
     */
    public int position() {
        return stream.position();
    }

    public String input() {
        return stream.input();
    }

    private void readNext() {
        lookahead = null;
        lookaheadError = null;

        while (!stream.isAtEnd() && Character.isWhitespace(stream.peek())) {
            stream.advance();
        }
        if (stream.isAtEnd()) {
            return;
        }

        char c = stream.peek();
        if (context.isLiteralSymbol(c)) {
            lookahead = readName();
        } else if (context.isNumberSymbol(c) || c == '.') {
            lookahead = readNumber();
        } else if (context.isOperation(String.valueOf(c))) {
            stream.advance();
            lookahead = Token.of(TokenType.OPERATION, String.valueOf(c), stream.position() - 1);
        } else if (context.isPunctuationSymbol(c)) {
            stream.advance();
            lookahead = Token.of(TokenType.PUNCTUATION, String.valueOf(c), stream.position() - 1);
        } else {
            lookaheadError = new TokenException(String.valueOf(c), stream.input(), stream.position());
        }

        if (log.isTraceEnabled()) {
            log.trace("Read token {} at position {}", lookahead != null ? lookahead.type() + " '" + lookahead.text() + "'" : "<error>", stream.position());
        }
    }

    private Token readName() {
        StringBuilder text = new StringBuilder();
        while (!stream.isAtEnd() && (context.isLiteralSymbol(stream.peek()) || context.isNumberSymbol(stream.peek()))) {
            text.append(stream.advance());
        }
        String name = text.toString();
        int end = stream.position() - 1;
        boolean call = !stream.isAtEnd() && stream.peek() == '(';

        TokenType type;
        if (!call && context.isBuiltInConstant(name)) {
            type = TokenType.CONSTANT;
        } else if (!call && context.isUserConstant(name)) {
            type = TokenType.USER_CONSTANT;
        } else if (call && context.isBuiltInFunction(name)) {
            type = TokenType.FUNCTION;
        } else if (call && context.isUserFunction(name)) {
            type = TokenType.USER_FUNCTION;
        } else if (call) {
            type = TokenType.UNKNOWN_FUNCTION;
        } else {
            type = TokenType.UNKNOWN_CONSTANT;
        }
        return Token.of(type, name, end);
    }

    /**
     * Reads a numeric literal. Letters following the digits are swallowed into the literal so that
     * an input like {@code 5h} is reported as one invalid literal instead of two tokens.
     */
    private Token readNumber() {
        StringBuilder text = new StringBuilder();
        boolean firstChar = true;
        boolean lastWasExponent = false;
        boolean radixZero = false;
        NumberType numberType = NumberType.REAL;

        while (!stream.isAtEnd()) {
            char c = stream.peek();
            if (context.isNumberSymbol(c)) {
                radixZero = c == '0' && firstChar;
                lastWasExponent = false;
            } else if (c == '.') {
                radixZero = false;
                lastWasExponent = false;
            } else if (c == 'i' && !firstChar) {
                numberType = NumberType.COMPLEX;
                stream.advance();
                break;
            } else if (c == 'E') {
                radixZero = false;
                lastWasExponent = true;
            } else if ((c == '+' || c == '-') && lastWasExponent) {
                radixZero = false;
                lastWasExponent = false;
            } else if ((c == 'x' || c == 'o' || c == 'b') && radixZero) {
                radixZero = false;
                lastWasExponent = false;
            } else if (isHexLetter(c)) {
                radixZero = false;
                lastWasExponent = false;
            } else if (!context.isLiteralSymbol(c)) {
                break;
            }
            text.append(stream.advance());
            firstChar = false;
        }

        String literal = text.toString();
        if (literal.startsWith(".")) {
            literal = "0" + literal;
        }
        return Token.number(numberType, literal, stream.position() - 1);
    }

    private static boolean isHexLetter(char c) {
        return c >= 'a' && c <= 'f';
    }
}
