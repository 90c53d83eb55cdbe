package com.jpexs.decompiler.restructure.structure;

import com.jpexs.decompiler.restructure.Node;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * Represents a loop after it was brought to single-entry/single-exit form.
 */
public class LoopStructure {
    public final Node header;               // single loop header, the dispatch head for irreducible loops
    public final Set<Node> body;            // nodes of the loop, its dispatch head and latch included
    public final Node latch;                // node holding the back edges
    public final List<Node> originalHeaders; // headers before repair, more than one for irreducible loops
    public final Node dispatchHead;         // null unless the loop was irreducible
    public final Node exitLatch;            // null unless the loop had several exit targets

    public LoopStructure(Node header, Set<Node> body, Node latch, List<Node> originalHeaders,
            Node dispatchHead, Node exitLatch) {
        this.header = header;
        this.body = Collections.unmodifiableSet(body);
        this.latch = latch;
        this.originalHeaders = Collections.unmodifiableList(new ArrayList<>(originalHeaders));
        this.dispatchHead = dispatchHead;
        this.exitLatch = exitLatch;
    }

    public boolean isIrreducible() {
        return dispatchHead != null;
    }

    @Override
    public String toString() {
        return "Loop{header=" + header +
               ", body=" + body +
               ", latch=" + latch +
               ", originalHeaders=" + originalHeaders +
               ", exitLatch=" + exitLatch + "}";
    }
}
