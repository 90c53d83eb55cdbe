package com.jpexs.decompiler.restructure;

import com.jpexs.decompiler.restructure.region.BranchRegion;
import com.jpexs.decompiler.restructure.region.LoopRegion;
import com.jpexs.decompiler.restructure.region.Region;
import com.jpexs.decompiler.restructure.region.RegionKind;
import com.jpexs.decompiler.restructure.region.SequenceRegion;
import java.util.*;

/**
 * Checks that a region tree covers the restructured graph and that every region
 * has a single entry and a single exit.
 *
 * <p>Each edge is checked against the regions it enters or leaves: the regions between
 * the block of its source or target and the smallest region containing both.
 *
 * @author JPEXS
 */
final class RegionVerifier {

    private final List<Node> nodes;
    private final List<Region> regions = new ArrayList<>();
    private final Map<Region, Region> parents = new IdentityHashMap<>();
    private final Map<Region, Integer> depths = new IdentityHashMap<>();
    private final Map<Node, Region> blocks = new HashMap<>();
    private final Map<Region, Set<Node>> exits = new IdentityHashMap<>();

    /**
     * @param nodes all nodes of the restructured graph
     */
    RegionVerifier(List<Node> nodes) {
        this.nodes = nodes;
    }

    /**
     * Verifies the tree.
     *
     * @param root the root region
     * @throws StructuringInvariantViolationException on the first violation found
     */
    void verify(Region root) {
        index(root);
        Set<Node> seen = new HashSet<>(blocks.keySet());
        for (Node node : nodes) {
            if (!seen.remove(node)) {
                fail("Node " + node + " is missing in the region tree");
            }
        }
        if (!seen.isEmpty()) {
            fail("Nodes " + seen + " of the region tree are not part of the graph");
        }

        for (Node node : nodes) {
            for (Edge edge : node.getSuccessors()) {
                if (edge.isBackEdge()) {
                    checkBackEdge(node, edge);
                } else {
                    checkEdge(node, edge.getTarget());
                }
            }
        }

        for (Region region : regions) {
            if (region.isEmpty()) {
                continue;
            }
            switch (region.getKind()) {
                case BLOCK:
                    // a discriminator block leaves to its arms, the enclosing branch is checked instead
                    continue;
                case SEQUENCE:
                    checkSequence((SequenceRegion) region);
                    break;
                case BRANCH:
                    checkBranch((BranchRegion) region);
                    break;
                case LOOP:
                    checkLoop((LoopRegion) region);
                    break;
            }
            Set<Node> regionExits = getExits(region);
            if (regionExits.size() > 1) {
                fail(region.getKind() + " region at " + region.getEntryNode() + " exits to " + regionExits);
            }
        }
    }

    private void index(Region root) {
        Deque<Region> todo = new ArrayDeque<>();
        todo.push(root);
        depths.put(root, 0);
        while (!todo.isEmpty()) {
            Region region = todo.pop();
            regions.add(region);
            if (region.getKind() == RegionKind.BLOCK) {
                Node node = region.getEntryNode();
                if (blocks.put(node, region) != null) {
                    fail("Node " + node + " appears more than once in the region tree");
                }
                continue;
            }
            for (Region child : region.getChildren()) {
                if (parents.containsKey(child) || child == root) {
                    fail("Region at " + child.getEntryNode() + " appears more than once in the region tree");
                }
                parents.put(child, region);
                depths.put(child, depths.get(region) + 1);
                todo.push(child);
            }
        }
    }

    /**
     * Walks from the blocks of both ends up to the smallest region containing both.
     * Regions on the source side are left by the edge, regions on the target side are entered.
     */
    private void checkEdge(Node source, Node target) {
        Region from = blocks.get(source);
        Region to = blocks.get(target);
        while (depths.get(from) > depths.get(to)) {
            leave(from, source, target);
            from = parents.get(from);
        }
        while (depths.get(to) > depths.get(from)) {
            enter(to, source, target);
            to = parents.get(to);
        }
        while (from != to) {
            leave(from, source, target);
            enter(to, source, target);
            from = parents.get(from);
            to = parents.get(to);
        }
    }

    private void leave(Region region, Node source, Node target) {
        getExits(region).add(target);
        if (region.getKind() == RegionKind.LOOP && source != ((LoopRegion) region).getLatch()) {
            fail("Loop at " + region.getEntryNode() + " is left from " + source + " instead of latch "
                    + ((LoopRegion) region).getLatch());
        }
    }

    private void enter(Region region, Node source, Node target) {
        if (target != region.getEntryNode()) {
            fail(region.getKind() + " region at " + region.getEntryNode() + " is entered at " + target + " from " + source);
        }
    }

    private Set<Node> getExits(Region region) {
        return exits.computeIfAbsent(region, k -> new TreeSet<>(Node.INDEX_ORDER));
    }

    private void checkBackEdge(Node source, Edge edge) {
        for (Region region = blocks.get(source); region != null; region = parents.get(region)) {
            if (region.getKind() == RegionKind.LOOP && ((LoopRegion) region).getHeader() == edge.getTarget()) {
                return;
            }
        }
        fail("Back edge " + source + " " + edge + " does not lead to an enclosing loop header");
    }

    private void checkSequence(SequenceRegion sequence) {
        List<Region> children = sequence.getChildren();
        for (int i = 0; i + 1 < children.size(); i++) {
            Node next = children.get(i + 1).getEntryNode();
            for (Node exit : getExits(children.get(i))) {
                if (exit != next) {
                    fail("Sequence member at " + children.get(i).getEntryNode() + " continues at " + exit
                            + " instead of " + next);
                }
            }
        }
    }

    private void checkBranch(BranchRegion branch) {
        Node discriminator = branch.getEntryNode();
        List<Edge> edges = discriminator.getForwardEdges();
        List<Integer> edgeArms = branch.getEdgeArms();
        if (edgeArms.size() != edges.size()) {
            fail("Branch " + discriminator + " selects arms for " + edgeArms.size() + " edges but has " + edges.size() + " edges");
        }
        Set<Integer> selected = new HashSet<>(edgeArms);
        for (int a = 0; a < branch.getArms().size(); a++) {
            if (!selected.contains(a)) {
                fail("Arm " + a + " of branch " + discriminator + " is not selected by any edge");
            }
        }
        for (int i = 0; i < edges.size(); i++) {
            Region arm = branch.getArmOfEdge(i);
            if (!arm.isEmpty() && arm.getEntryNode() != edges.get(i).getTarget()) {
                fail("Arm of edge " + i + " of branch " + discriminator + " starts at " + arm.getEntryNode()
                        + " instead of " + edges.get(i).getTarget());
            }
        }
    }

    private void checkLoop(LoopRegion loop) {
        Node latch = loop.getLatch();
        if (loop.getBody().getEntryNode() != loop.getHeader()) {
            fail("Loop body starts at " + loop.getBody().getEntryNode() + " instead of header " + loop.getHeader());
        }
        boolean member = false;
        for (Region region = blocks.get(latch); region != null; region = parents.get(region)) {
            if (region == loop) {
                member = true;
                break;
            }
        }
        if (!member) {
            fail("Latch " + latch + " is not part of the loop at " + loop.getHeader());
        }
        boolean hasBackEdge = false;
        for (Edge edge : latch.getSuccessors()) {
            if (edge.isBackEdge() && edge.getTarget() == loop.getHeader()) {
                hasBackEdge = true;
            }
        }
        if (!hasBackEdge) {
            fail("Latch " + latch + " does not jump back to " + loop.getHeader());
        }
    }

    private static void fail(String message) {
        throw new StructuringInvariantViolationException(message);
    }
}
