package com.jpexs.decompiler.restructure.region;

import com.jpexs.decompiler.restructure.Node;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Regions executed one after another.
 * An empty sequence is the empty arm of a branch.
 *
 * @author JPEXS
 */
public final class SequenceRegion extends Region {

    private final List<Region> children;

    public SequenceRegion(List<Region> children) {
        this.children = children != null ? new ArrayList<>(children) : new ArrayList<>();
    }

    /**
     * Creates an empty sequence.
     *
     * @return the empty sequence
     */
    public static SequenceRegion empty() {
        return new SequenceRegion(null);
    }

    @Override
    public RegionKind getKind() {
        return RegionKind.SEQUENCE;
    }

    @Override
    public Node getEntryNode() {
        for (Region child : children) {
            if (!child.isEmpty()) {
                return child.getEntryNode();
            }
        }
        return null;
    }

    @Override
    public List<Region> getChildren() {
        return Collections.unmodifiableList(children);
    }

    @Override
    public String toString(String indent) {
        StringBuilder sb = new StringBuilder();
        for (Region child : children) {
            sb.append(child.toString(indent));
        }
        return sb.toString();
    }
}
