package com.jpexs.decompiler.restructure;

import com.google.common.flogger.GoogleLogger;
import com.jpexs.decompiler.restructure.structure.LoopStructure;
import java.util.*;

/**
 * Brings every loop of a graph view to single-entry/single-exit form.
 *
 * <p>For each strongly connected component:
 * <ol>
 * <li>several headers are merged by a dispatch head, which becomes the only header</li>
 * <li>several exit targets are merged by an exit latch placed after the loop</li>
 * <li>back edges and exits are collected in one latch node, either an existing node
 * already doing that or a new loop latch</li>
 * </ol>
 * Back edges are flagged, so the loop body is acyclic when structured afterwards.
 *
 * @author JPEXS
 */
final class LoopRestructurer {

    private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

    private final Restructurer restructurer;

    LoopRestructurer(Restructurer restructurer) {
        this.restructurer = restructurer;
    }

    /**
     * Restructures the outermost loops of the view. Nested loops stay unchanged
     * until the body of their enclosing loop is structured.
     *
     * @param view the view, synthetic nodes are added to it
     * @return the loops, ordered by their first node
     */
    List<LoopStructure> restructureLoops(GraphView view) {
        List<LoopStructure> ret = new ArrayList<>();
        for (TreeSet<Node> scc : SccFinder.findLoops(view)) {
            ret.add(restructureLoop(view, scc));
        }
        return ret;
    }

    private LoopStructure restructureLoop(GraphView view, TreeSet<Node> loop) {
        List<Node> headers = view.findHeaders(loop);
        if (headers.isEmpty()) {
            throw new StructuringInvariantViolationException("Loop " + loop + " has no header");
        }

        Node header;
        Node dispatchHead = null;
        if (headers.size() > 1) {
            logger.atFine().log("Loop %s is irreducible, headers %s, entered from %s", loop, headers, view.findEntries(loop));
            dispatchHead = restructurer.insertDispatch(NodeRole.DISPATCH_HEAD, view.getEdgesInto(headers),
                    Restructurer.DESTINATION_ORDER);
            loop.add(dispatchHead);
            view.add(dispatchHead);
            header = dispatchHead;
        } else {
            header = headers.get(0);
        }

        Node exitLatch = null;
        List<Node> exitTargets = GraphView.findExitTargets(loop);
        if (exitTargets.size() > 1) {
            logger.atFine().log("Loop %s exits to %s from %s", loop, exitTargets, GraphView.findExitingNodes(loop));
            exitLatch = restructurer.insertDispatch(NodeRole.EXIT_LATCH, GraphView.getEdgesLeaving(loop),
                    Restructurer.DESTINATION_ORDER);
            view.add(exitLatch);
        }

        List<EdgeRef> backEdges = new ArrayList<>();
        for (Node node : loop) {
            List<Edge> succs = node.getSuccessors();
            for (int i = 0; i < succs.size(); i++) {
                if (!succs.get(i).isBackEdge() && succs.get(i).getTarget() == header) {
                    backEdges.add(new EdgeRef(node, i));
                }
            }
        }
        List<EdgeRef> exitEdges = GraphView.getEdgesLeaving(loop);

        Node latch = findNaturalLatch(backEdges, exitEdges);
        if (latch != null) {
            for (EdgeRef ref : backEdges) {
                ref.redirect(ref.getEdge().asBackEdge());
            }
        } else {
            List<EdgeRef> latchEdges = new ArrayList<>(backEdges);
            latchEdges.addAll(exitEdges);
            final Node loopHeader = header;
            Comparator<Edge> headerFirst = Comparator
                    .comparing((Edge edge) -> edge.getTarget() != loopHeader)
                    .thenComparing(Restructurer.DESTINATION_ORDER);
            latch = restructurer.insertDispatch(NodeRole.LOOP_LATCH, latchEdges, headerFirst);
            List<Edge> succs = latch.getSuccessors();
            for (int i = 0; i < succs.size(); i++) {
                if (succs.get(i).getTarget() == header) {
                    latch.setEdge(i, succs.get(i).asBackEdge());
                }
            }
            loop.add(latch);
            view.add(latch);
        }

        LoopStructure structure = new LoopStructure(header, loop, latch, headers, dispatchHead, exitLatch);
        logger.atFine().log("%s", structure);
        return structure;
    }

    /**
     * Finds an existing node that can serve as the latch: the only source of all
     * back edges and exits, with no other forward edges.
     *
     * @param backEdges edges to the header
     * @param exitEdges edges leaving the loop
     * @return the latch, or null if a loop latch has to be inserted
     */
    private static Node findNaturalLatch(List<EdgeRef> backEdges, List<EdgeRef> exitEdges) {
        Node source = null;
        List<EdgeRef> all = new ArrayList<>(backEdges);
        all.addAll(exitEdges);
        for (EdgeRef ref : all) {
            if (source == null) {
                source = ref.source;
            } else if (source != ref.source) {
                return null;
            }
        }
        if (source == null || source.getForwardEdges().size() != all.size()) {
            return null;
        }
        return source;
    }
}
