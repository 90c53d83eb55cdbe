package com.jpexs.decompiler.restructure.region;

import com.jpexs.decompiler.restructure.Edge;
import com.jpexs.decompiler.restructure.Node;
import java.util.Collections;
import java.util.List;

/**
 * Loop: a body region entered at the header and ended by the latch.
 * The latch either jumps back to the header or leaves the loop to the exit target.
 *
 * @author JPEXS
 */
public final class LoopRegion extends Region {

    private final Region body;
    private final Node header;
    private final Node latch;

    public LoopRegion(Region body, Node header, Node latch) {
        this.body = body;
        this.header = header;
        this.latch = latch;
    }

    public Region getBody() {
        return body;
    }

    /**
     * Gets the loop header, the continue target.
     *
     * @return the header
     */
    public Node getHeader() {
        return header;
    }

    /**
     * Gets the last node of the loop body, the source of all back edges.
     *
     * @return the latch
     */
    public Node getLatch() {
        return latch;
    }

    /**
     * Gets the node where execution continues after the loop.
     *
     * @return the exit target, or null if the loop is only left by returning
     */
    public Node getExitTarget() {
        for (Edge edge : latch.getSuccessors()) {
            if (!edge.isBackEdge()) {
                return edge.getTarget();
            }
        }
        return null;
    }

    @Override
    public RegionKind getKind() {
        return RegionKind.LOOP;
    }

    @Override
    public Node getEntryNode() {
        return header;
    }

    @Override
    public List<Region> getChildren() {
        return Collections.singletonList(body);
    }

    @Override
    public String toString(String indent) {
        StringBuilder sb = new StringBuilder();
        sb.append(indent).append("loop {\n");
        sb.append(body.toString(indent + "    "));
        sb.append(indent).append("}\n");
        return sb.toString();
    }
}
