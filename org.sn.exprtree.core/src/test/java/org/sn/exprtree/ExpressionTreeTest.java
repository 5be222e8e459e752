package org.sn.exprtree;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.sn.exprtree.testutils.TestUtil.assertException;
import static org.sn.exprtree.testutils.TestUtil.tokens;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.sn.exprtree.ExpressionTree.Listener;
import org.sn.exprtree.ExpressionTree.OperatorPosition;
import org.sn.exprtree.testutils.TestBase;


public class ExpressionTreeTest extends TestBase {
    @Test
    void testBuilder() {
        var builder = ExpressionTree.builder();
        int seven = builder.addLeaf("7");
        int eight = builder.addLeaf("8");
        int times = builder.addOperator(Operator.TIMES, seven, eight);
        assertEquals(3, builder.size());
        ExpressionTree tree = builder.build(times);

        assertEquals(times, tree.getRoot());
        assertEquals("(7 * 8)", tree.toString());
        assertEquals(seven, tree.getLeft(times));
        assertEquals(eight, tree.getRight(times));
    }

    @Test
    void testBuilderRejectsInvalidTrees() {
        var builder = ExpressionTree.builder();
        assertException(() -> builder.addLeaf("+"), IllegalArgumentException.class);
        assertException(() -> builder.addLeaf(""), IllegalArgumentException.class);

        int one = builder.addLeaf("1");
        int two = builder.addLeaf("2");
        assertException(() -> builder.addOperator(Operator.PLUS, one, one), IllegalArgumentException.class);
        assertException(() -> builder.addOperator(Operator.PLUS, one, 5), IllegalArgumentException.class);
        assertException(() -> builder.build(one), IllegalStateException.class); // two has no parent

        int plus = builder.addOperator(Operator.PLUS, one, two);
        assertException(() -> builder.addOperator(Operator.MINUS, one, plus), IllegalArgumentException.class); // one is shared
        assertException(() -> builder.build(one), IllegalArgumentException.class); // one is not a root
        assertEquals("(1 + 2)", builder.build(plus).toString());
    }

    @Test
    void testInvalidNodeId() throws ExpressionTreeException {
        ExpressionTree tree = ExpressionTreeBuilder.fromPostfix(tokens("1 2 +"));
        assertThrows(IndexOutOfBoundsException.class, () -> tree.getValue(3));
        assertThrows(IndexOutOfBoundsException.class, () -> tree.getLeft(ExpressionTree.NO_NODE));
    }

    @Test
    void testEqualsIgnoresNodeIds() throws ExpressionTreeException {
        ExpressionTree fromPostfix = ExpressionTreeBuilder.fromPostfix(tokens("1 2 + 3 *"));
        ExpressionTree fromPrefix = ExpressionTreeBuilder.fromPrefix(tokens("* + 1 2 3"));
        assertNotEquals(fromPostfix.getRoot(), fromPrefix.getRoot());
        assertEquals(fromPostfix, fromPrefix);
        assertEquals(fromPostfix.hashCode(), fromPrefix.hashCode());

        assertNotEquals(fromPostfix, ExpressionTreeBuilder.fromPostfix(tokens("1 2 3 * +")));
        assertNotEquals(fromPostfix, ExpressionTreeBuilder.fromPostfix(tokens("2 1 + 3 *")));
        assertNotEquals(fromPostfix, "(1 + 2) * 3");
    }

    @Test
    void testReduce() throws ExpressionTreeException {
        ExpressionTree tree = ExpressionTreeBuilder.fromPostfix(tokens("7 8 * 2 4 / -"));

        // prints a-b like MINUS(a, b)
        var str = new StringBuilder();
        tree.reduce(new Listener<RuntimeException>() {
            @Override
            public OperatorPosition operatorPosition() {
                return OperatorPosition.OPERATOR_FIRST;
            }

            @Override
            public void acceptOperator(int nodeId, Operator operator) {
                str.append(operator.name()).append('(');
            }

            @Override
            public void nextOperatorArgument(int nodeId, Operator operator) {
                str.append(", ");
            }

            @Override
            public void endOperator(int nodeId, Operator operator) {
                str.append(')');
            }

            @Override
            public void acceptOperand(int nodeId, String value) {
                str.append(value);
            }
        });
        assertEquals("MINUS(TIMES(7, 8), DIVIDE(2, 4))", str.toString());
    }

    @Test
    void testReduceVisitsEachNodeOnce() throws ExpressionTreeException {
        ExpressionTree tree = ExpressionTreeBuilder.fromPostfix(tokens("1 1 + 1 1 + *"));
        List<Integer> visited = new ArrayList<>();
        tree.reduce(new Listener<RuntimeException>() {
            @Override
            public OperatorPosition operatorPosition() {
                return OperatorPosition.OPERATOR_MIDDLE;
            }

            @Override
            public void acceptOperator(int nodeId, Operator operator) {
                visited.add(nodeId);
            }

            @Override
            public void acceptOperand(int nodeId, String value) {
                visited.add(nodeId);
            }
        });
        assertEquals(List.of(0, 2, 1, 6, 3, 5, 4), visited);
    }

    @Test
    void testDeepTree() throws ExpressionTreeException {
        final int depth = 200_000;
        List<String> postfix = new ArrayList<>(2 * depth + 1);
        postfix.add("1");
        for (int i = 0; i < depth; i++) {
            postfix.add("1");
            postfix.add("+");
        }
        ExpressionTree tree = ExpressionTreeBuilder.fromPostfix(postfix);
        assertEquals(2 * depth + 1, tree.size());
        assertEquals(postfix, ExpressionTreeConverter.toPostfix(tree));
        assertEquals(depth + 1.0, ExpressionTreeEvaluator.builder().build().evaluate(tree));
        assertEquals(tree, ExpressionTreeBuilder.fromPrefix(ExpressionTreeConverter.toPrefix(tree)));
    }
}
