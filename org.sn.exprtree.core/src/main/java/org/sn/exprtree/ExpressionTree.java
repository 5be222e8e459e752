package org.sn.exprtree;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import org.sn.exprtree.annotations.NotNull;
import org.sn.exprtree.annotations.NotThreadSafe;
import org.sn.exprtree.annotations.Nullable;


/**
 * An immutable binary expression tree.
 *
 * <p>Nodes are stored in an arena and addressed by an integer id from 0 to size() - 1.
 * An operand node is a leaf and has no children.
 * An operator node always has both a left and right child.
 * Every node other than the root has exactly one parent.
 *
 * <p>The node id is stable for the lifetime of the tree, so it can be used as a key when rendering the tree,
 * even when two leaves hold the same value.
 * As nothing modifies a tree once built, the same tree may be read by many threads.
 *
 * <p>Two trees are equal if they have the same shape and the same value at each position.
 * The node ids do not take part in the comparison.
 */
public final class ExpressionTree {
    /**
     * The child id of a leaf.
     */
    public static final int NO_NODE = -1;

    public static Builder builder() {
        return new Builder();
    }

    private final String[] values;
    private final int[] lefts;
    private final int[] rights;
    private final int root;

    ExpressionTree(String[] values, int[] lefts, int[] rights, int root) {
        this.values = values;
        this.lefts = lefts;
        this.rights = rights;
        this.root = root;
    }

    public int getRoot() {
        return root;
    }

    /**
     * The number of nodes in this tree.
     */
    public int size() {
        return values.length;
    }

    /**
     * The token held by a node, for example "7" or "*".
     */
    public @NotNull String getValue(int nodeId) {
        return values[checkNodeId(nodeId)];
    }

    /**
     * The id of the left child, or NO_NODE if the node is a leaf.
     */
    public int getLeft(int nodeId) {
        return lefts[checkNodeId(nodeId)];
    }

    /**
     * The id of the right child, or NO_NODE if the node is a leaf.
     */
    public int getRight(int nodeId) {
        return rights[checkNodeId(nodeId)];
    }

    public boolean isLeaf(int nodeId) {
        return getLeft(nodeId) == NO_NODE && getRight(nodeId) == NO_NODE;
    }

    /**
     * The operator held by a node, or null if the node holds an operand.
     */
    public @Nullable Operator getOperator(int nodeId) {
        return Operator.fromToken(getValue(nodeId));
    }

    private int checkNodeId(int nodeId) {
        if (nodeId < 0 || nodeId >= values.length) {
            throw new IndexOutOfBoundsException("node " + nodeId + " not in tree of size " + values.length);
        }
        return nodeId;
    }

    /**
     * Return the operator if this node is an operator with both children, otherwise null.
     */
    private @Nullable Operator completeOperator(int nodeId) {
        Operator operator = Operator.fromToken(values[nodeId]);
        if (operator != null && lefts[nodeId] != NO_NODE && rights[nodeId] != NO_NODE) {
            return operator;
        }
        return null;
    }

    /**
     * Visit each node of this tree in a depth first manner, left child before right child.
     * The walk uses an explicit stack, so deeply nested expressions do not overflow the call stack.
     *
     * <p>A node that is not an operator with two children is passed to {@link Listener#acceptOperand}
     * and its children, if any, are not visited.
     *
     * @param listener receives callbacks for each node
     * @param <E> the exception the listener may throw
     * @throws E if the listener throws
     */
    public <E extends Exception> void reduce(Listener<E> listener) throws E {
        OperatorPosition position = listener.operatorPosition();
        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(root));
        while (!stack.isEmpty()) {
            Frame frame = stack.peek();
            int nodeId = frame.nodeId;
            Operator operator = completeOperator(nodeId);
            if (operator == null) {
                stack.pop();
                listener.acceptOperand(nodeId, values[nodeId]);
                continue;
            }
            switch (frame.step++) {
                case 0 -> {
                    listener.startOperator(nodeId, operator);
                    if (position == OperatorPosition.OPERATOR_FIRST) {
                        listener.acceptOperator(nodeId, operator);
                    }
                    stack.push(new Frame(lefts[nodeId]));
                }
                case 1 -> {
                    if (position == OperatorPosition.OPERATOR_MIDDLE) {
                        listener.acceptOperator(nodeId, operator);
                    }
                    listener.nextOperatorArgument(nodeId, operator);
                    stack.push(new Frame(rights[nodeId]));
                }
                default -> {
                    if (position == OperatorPosition.OPERATOR_LAST) {
                        listener.acceptOperator(nodeId, operator);
                    }
                    listener.endOperator(nodeId, operator);
                    stack.pop();
                }
            }
        }
    }

    private static final class Frame {
        private final int nodeId;
        private int step;

        private Frame(int nodeId) {
            this.nodeId = nodeId;
        }
    }

    @Override
    public boolean equals(Object thatObject) {
        if (this == thatObject) {
            return true;
        }
        if (!(thatObject instanceof ExpressionTree that)) {
            return false;
        }
        // every operator has exactly two children, so the postfix form determines the shape
        return ExpressionTreeConverter.toPostfix(this).equals(ExpressionTreeConverter.toPostfix(that));
    }

    @Override
    public int hashCode() {
        return ExpressionTreeConverter.toPostfix(this).hashCode();
    }

    /**
     * The fully parenthesized infix form, for example (7 * 8).
     */
    @Override
    public String toString() {
        return ExpressionTreeConverter.toInfix(this);
    }

    public enum OperatorPosition {
        OPERATOR_FIRST,
        OPERATOR_MIDDLE,
        OPERATOR_LAST
    }

    /**
     * Callbacks for {@link #reduce}.
     *
     * @param <E> the checked exception the callbacks may throw, RuntimeException if none
     */
    public interface Listener<E extends Exception> {
        /**
         * Tell when to call acceptOperator relative to visiting the left and right children.
         */
        OperatorPosition operatorPosition();

        /**
         * Called before visiting an operator. For example, calling code could add an open parenthesis.
         */
        default void startOperator(int nodeId, Operator operator) throws E { }

        /**
         * Called to accept the operator.
         */
        default void acceptOperator(int nodeId, Operator operator) throws E { }

        /**
         * Called after the left child is visited and before the right child is visited.
         */
        default void nextOperatorArgument(int nodeId, Operator operator) throws E { }

        /**
         * Called after visiting an operator. For example, calling code could add a close parenthesis.
         */
        default void endOperator(int nodeId, Operator operator) throws E { }

        /**
         * Called to accept a leaf.
         */
        default void acceptOperand(int nodeId, String value) throws E { }
    }

    /**
     * Builder of an expression tree.
     * Children must be added before their parent, which rules out cycles.
     */
    @NotThreadSafe
    public static final class Builder {
        private final List<String> values = new ArrayList<>();
        private final List<Integer> lefts = new ArrayList<>();
        private final List<Integer> rights = new ArrayList<>();
        private final BitSet hasParent = new BitSet();

        private Builder() {
        }

        public int size() {
            return values.size();
        }

        /**
         * Add a leaf.
         *
         * @return the id of the new node
         * @throws IllegalArgumentException if token is not an operand
         */
        public int addLeaf(@NotNull String token) {
            if (!Tokens.isOperand(token)) {
                throw new IllegalArgumentException("not an operand: " + token);
            }
            return add(token, NO_NODE, NO_NODE);
        }

        /**
         * Add an operator node whose children are nodes already added.
         *
         * @return the id of the new node
         * @throws IllegalArgumentException if a child does not exist, already has a parent, or left and right are the same
         */
        public int addOperator(@NotNull Operator operator, int left, int right) {
            Objects.requireNonNull(operator);
            checkOrphan(left);
            checkOrphan(right);
            if (left == right) {
                throw new IllegalArgumentException("left and right child are both node " + left);
            }
            hasParent.set(left);
            hasParent.set(right);
            return add(operator.getToken(), left, right);
        }

        private int add(String value, int left, int right) {
            values.add(value);
            lefts.add(left);
            rights.add(right);
            return values.size() - 1;
        }

        private void checkOrphan(int nodeId) {
            if (nodeId < 0 || nodeId >= values.size()) {
                throw new IllegalArgumentException("node " + nodeId + " has not been added");
            }
            if (hasParent.get(nodeId)) {
                throw new IllegalArgumentException("node " + nodeId + " already has a parent");
            }
        }

        /**
         * Build the tree.
         *
         * @param root the id of the root node
         * @throws IllegalArgumentException if root does not exist or has a parent
         * @throws IllegalStateException if some node other than root has no parent
         */
        public ExpressionTree build(int root) {
            checkOrphan(root);
            if (hasParent.cardinality() != values.size() - 1) {
                throw new IllegalStateException("nodes other than the root have no parent");
            }
            int n = values.size();
            int[] leftArray = new int[n];
            int[] rightArray = new int[n];
            for (int i = 0; i < n; i++) {
                leftArray[i] = lefts.get(i);
                rightArray[i] = rights.get(i);
            }
            return new ExpressionTree(values.toArray(new String[0]), leftArray, rightArray, root);
        }
    }
}
