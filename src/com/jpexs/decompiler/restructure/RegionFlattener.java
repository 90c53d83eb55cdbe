package com.jpexs.decompiler.restructure;

import com.jpexs.decompiler.restructure.region.Region;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns a region tree back into a plain CFG.
 *
 * @author JPEXS
 */
public final class RegionFlattener {

    private RegionFlattener() {
    }

    /**
     * Copies the nodes of the tree in pre-order. Synthetic roles and case values are kept,
     * back-edge flags are dropped. The entry of the graph is the entry of the root region.
     *
     * @param root the root region
     * @return the graph
     * @throws MalformedGraphException if the tree is empty or an edge leads outside of it
     */
    public static ControlFlowGraph flatten(Region root) {
        if (root.isEmpty()) {
            throw new MalformedGraphException("Cannot flatten an empty region");
        }
        Map<Node, Node> copies = new LinkedHashMap<>();
        for (Node node : root.getNodes()) {
            copies.put(node, new Node(node.getLabel(), node.getRole(), node.getPayload()));
        }
        for (Map.Entry<Node, Node> entry : copies.entrySet()) {
            for (Edge edge : entry.getKey().getSuccessors()) {
                Node target = copies.get(edge.getTarget());
                if (target == null) {
                    throw new MalformedGraphException("Edge " + entry.getKey() + " " + edge + " leads outside of the region");
                }
                entry.getValue().addSuccessor(target, edge.getCaseValue());
            }
        }
        List<Node> nodes = new ArrayList<>(copies.values());
        return new ControlFlowGraph(nodes, copies.get(root.getEntryNode()));
    }
}
