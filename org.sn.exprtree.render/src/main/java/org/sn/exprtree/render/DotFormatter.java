package org.sn.exprtree.render;

import org.sn.exprtree.annotations.NotNull;


/**
 * Write a render graph in the Graphviz DOT language, with each node drawn as a circle.
 * Run <code>dot -Tpng expression_tree.dot -o expression_tree.png</code> to get a picture.
 */
public class DotFormatter implements RenderFormatter {
    private static final String INDENT = "    ";

    @Override
    public @NotNull String fileExtension() {
        return "dot";
    }

    @Override
    public @NotNull String format(@NotNull RenderGraph graph) {
        var str = new StringBuilder();
        str.append("digraph ExpressionTree {\n");
        str.append(INDENT).append("node [shape=circle];\n");
        for (RenderNode node : graph.getNodes()) {
            str.append(INDENT)
               .append(nodeName(node.getId()))
               .append(" [label=\"").append(escape(node.getLabel())).append("\"];\n");
        }
        for (RenderEdge edge : graph.getEdges()) {
            str.append(INDENT)
               .append(nodeName(edge.getParentId()))
               .append(" -> ")
               .append(nodeName(edge.getChildId()))
               .append(";\n");
        }
        str.append("}\n");
        return str.toString();
    }

    private static String nodeName(int nodeId) {
        return "n" + nodeId;
    }

    private static String escape(String label) {
        return label.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
