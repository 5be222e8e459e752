package org.sn.exprtree.render;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.Objects;


/**
 * A line from a parent node to one of its children.
 */
@JsonPropertyOrder({"parent", "child"})
public final class RenderEdge {
    private final int parentId;
    private final int childId;

    public RenderEdge(int parentId, int childId) {
        this.parentId = parentId;
        this.childId = childId;
    }

    @JsonProperty("parent")
    public int getParentId() {
        return parentId;
    }

    @JsonProperty("child")
    public int getChildId() {
        return childId;
    }

    @Override
    public boolean equals(Object thatObject) {
        if (this == thatObject) {
            return true;
        }
        if (!(thatObject instanceof RenderEdge that)) {
            return false;
        }
        return this.parentId == that.parentId && this.childId == that.childId;
    }

    @Override
    public int hashCode() {
        return Objects.hash(parentId, childId);
    }

    @Override
    public String toString() {
        return parentId + "->" + childId;
    }
}
