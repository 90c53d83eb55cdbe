package com.jpexs.decompiler.restructure.region;

import com.jpexs.decompiler.restructure.Node;
import java.util.Collections;
import java.util.List;

/**
 * Region wrapping exactly one node.
 *
 * @author JPEXS
 */
public final class BlockRegion extends Region {

    private final Node node;

    public BlockRegion(Node node) {
        if (node == null) {
            throw new IllegalArgumentException("Block region needs a node");
        }
        this.node = node;
    }

    public Node getNode() {
        return node;
    }

    @Override
    public RegionKind getKind() {
        return RegionKind.BLOCK;
    }

    @Override
    public Node getEntryNode() {
        return node;
    }

    @Override
    public List<Region> getChildren() {
        return Collections.emptyList();
    }

    @Override
    public String toString(String indent) {
        if (node.isSynthetic()) {
            return indent + node.getLabel() + "; // " + node.getRole().getAttributeValue() + "\n";
        }
        return indent + node.getLabel() + ";\n";
    }
}
