package org.termcalc.core.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * A node of an ordered tree that exclusively owns its children.
 * <p>
 * Nodes are never shared between trees: a node added as a child belongs to exactly one parent,
 * and {@link #deepCopy()} produces a structurally independent tree. The content itself is
 * expected to be immutable (e.g. a token record), so copying the node structure is sufficient.
 *
 * @param <T> The type of the content stored in each node.
 */
public final class TreeNode<T> {

    private final T content;
    private final List<TreeNode<T>> children = new ArrayList<>();

    /**
     * Creates a new leaf node.
     * @param content The content of the node, must not be null.
     */
    public TreeNode(T content) {
        this.content = Objects.requireNonNull(content, "content");
    }

    /**
     * Creates a new node with the given children. The children are taken over, not copied.
     * @param content The content of the node.
     * @param children The children of the node in order.
     */
    public TreeNode(T content, List<TreeNode<T>> children) {
        this(content);
        for (TreeNode<T> child : children) {
            addChild(child);
        }
    }

    /**
     * @return The content of this node.
     */
    public T getContent() {
        return content;
    }

    /**
     * Returns a read-only view of the direct children.
     * @return The children in order. Empty for a leaf.
     */
    public List<TreeNode<T>> getChildren() {
        return Collections.unmodifiableList(children);
    }

    /**
     * Appends a child to this node.
     * @param child The child to append.
     */
    public void addChild(TreeNode<T> child) {
        children.add(Objects.requireNonNull(child, "child"));
    }

    /**
     * @param index The index of the child.
     * @return The child at the given index.
     */
    public TreeNode<T> getChild(int index) {
        return children.get(index);
    }

    /**
     * @return The number of direct children.
     */
    public int childCount() {
        return children.size();
    }

    /**
     * @return {@code true} if this node has no children.
     */
    public boolean isLeaf() {
        return children.isEmpty();
    }

    /**
     * Creates an independent copy of this subtree.
     * @return The copied subtree.
     */
    public TreeNode<T> deepCopy() {
        TreeNode<T> copy = new TreeNode<>(content);
        for (TreeNode<T> child : children) {
            copy.addChild(child.deepCopy());
        }
        return copy;
    }

    /**
     * Returns a copy of this subtree in which every leaf matching the predicate is replaced by
     * the subtree produced by the replacement function. The whole tree is walked, and this tree
     * is left untouched.
     *
     * @param matcher Selects the leaves to replace.
     * @param replacement Produces the replacement for a matched leaf. The result is attached as is,
     *                    so callers must hand out fresh subtrees.
     * @return The transformed copy.
     */
    public TreeNode<T> replaceLeaves(Predicate<TreeNode<T>> matcher, Function<TreeNode<T>, TreeNode<T>> replacement) {
        if (isLeaf() && matcher.test(this)) {
            return replacement.apply(this);
        }
        TreeNode<T> copy = new TreeNode<>(content);
        for (TreeNode<T> child : children) {
            copy.addChild(child.replaceLeaves(matcher, replacement));
        }
        return copy;
    }

    /**
     * Finds the first node (pre-order) that satisfies the predicate.
     * @param predicate The condition to test.
     * @return The first matching node, or null if none matches.
     */
    public TreeNode<T> findFirst(Predicate<TreeNode<T>> predicate) {
        if (predicate.test(this)) {
            return this;
        }
        for (TreeNode<T> child : children) {
            TreeNode<T> found = child.findFirst(predicate);
            if (found != null) {
                return found;
            }
        }
        return null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TreeNode<?> other)) return false;
        return content.equals(other.content) && children.equals(other.children);
    }

    @Override
    public int hashCode() {
        return Objects.hash(content, children);
    }

    /**
     * Renders the tree in prefix form, e.g. {@code (+ (1 ), (2 ), )}.
     */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append('(').append(content).append(' ');
        for (TreeNode<T> child : children) {
            sb.append(child).append(", ");
        }
        sb.append(')');
        return sb.toString();
    }
}
