package org.sn.exprtree.render;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.sn.exprtree.ExpressionTree;
import org.sn.exprtree.ExpressionTree.Listener;
import org.sn.exprtree.ExpressionTree.OperatorPosition;
import org.sn.exprtree.Operator;
import org.sn.exprtree.annotations.NotNull;


/**
 * The nodes and edges of an expression tree, in the form a diagramming tool wants.
 *
 * <p>Node ids are the ids of the tree, so they are unique even when two leaves have the same label.
 * Nodes are listed parent before children, left subtree before right subtree,
 * and edges are listed in the same order by parent, left child first.
 */
@JsonPropertyOrder({"nodes", "edges"})
public final class RenderGraph {
    private final @NotNull List<RenderNode> nodes;
    private final @NotNull List<RenderEdge> edges;

    private RenderGraph(List<RenderNode> nodes, List<RenderEdge> edges) {
        this.nodes = Collections.unmodifiableList(nodes);
        this.edges = Collections.unmodifiableList(edges);
    }

    public static @NotNull RenderGraph of(@NotNull ExpressionTree tree) {
        List<RenderNode> nodes = new ArrayList<>(tree.size());
        List<RenderEdge> edges = new ArrayList<>(Math.max(tree.size() - 1, 0));
        tree.reduce(new Listener<RuntimeException>() {
            @Override
            public OperatorPosition operatorPosition() {
                return OperatorPosition.OPERATOR_FIRST;
            }

            @Override
            public void acceptOperator(int nodeId, Operator operator) {
                nodes.add(new RenderNode(nodeId, operator.getToken()));
                edges.add(new RenderEdge(nodeId, tree.getLeft(nodeId)));
                edges.add(new RenderEdge(nodeId, tree.getRight(nodeId)));
            }

            @Override
            public void acceptOperand(int nodeId, String value) {
                nodes.add(new RenderNode(nodeId, value));
            }
        });
        return new RenderGraph(nodes, edges);
    }

    @JsonProperty("nodes")
    public @NotNull List<RenderNode> getNodes() {
        return nodes;
    }

    @JsonProperty("edges")
    public @NotNull List<RenderEdge> getEdges() {
        return edges;
    }
}
