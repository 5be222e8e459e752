package org.sn.exprtree.render;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.Objects;
import org.sn.exprtree.annotations.NotNull;


/**
 * One node of a tree to draw, identified by its node id in the tree.
 */
@JsonPropertyOrder({"id", "label"})
public final class RenderNode {
    private final int id;
    private final @NotNull String label;

    public RenderNode(int id, @NotNull String label) {
        this.id = id;
        this.label = Objects.requireNonNull(label);
    }

    @JsonProperty("id")
    public int getId() {
        return id;
    }

    @JsonProperty("label")
    public @NotNull String getLabel() {
        return label;
    }

    @Override
    public boolean equals(Object thatObject) {
        if (this == thatObject) {
            return true;
        }
        if (!(thatObject instanceof RenderNode that)) {
            return false;
        }
        return this.id == that.id && this.label.equals(that.label);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, label);
    }

    @Override
    public String toString() {
        return id + "=" + label;
    }
}
