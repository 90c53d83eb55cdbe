package com.jpexs.decompiler.restructure.region;

import com.jpexs.decompiler.restructure.Node;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Node of the region tree: a single-entry/single-exit part of the restructured graph.
 *
 * @author JPEXS
 */
public abstract class Region {

    /**
     * Gets the kind of this region.
     *
     * @return the kind
     */
    public abstract RegionKind getKind();

    /**
     * Gets the node executed first when control enters this region.
     *
     * @return the entry node, or null for an empty sequence
     */
    public abstract Node getEntryNode();

    /**
     * Gets the direct children of this region.
     *
     * @return the children, empty for a block region
     */
    public abstract List<Region> getChildren();

    /**
     * Gets all nodes of this region in pre-order.
     *
     * @return the nodes
     */
    public List<Node> getNodes() {
        List<Node> ret = new ArrayList<>();
        Deque<Region> todo = new ArrayDeque<>();
        todo.push(this);
        while (!todo.isEmpty()) {
            Region region = todo.pop();
            if (region.getKind() == RegionKind.BLOCK) {
                ret.add(region.getEntryNode());
                continue;
            }
            List<Region> children = region.getChildren();
            for (int i = children.size() - 1; i >= 0; i--) {
                todo.push(children.get(i));
            }
        }
        return ret;
    }

    public boolean isEmpty() {
        return getEntryNode() == null;
    }

    @Override
    public String toString() {
        return toString("");
    }

    /**
     * Converts this region to structured pseudocode.
     *
     * @param indent the indentation prefix
     * @return the pseudocode
     */
    public abstract String toString(String indent);
}
