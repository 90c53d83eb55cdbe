package com.jpexs.decompiler.restructure;

import com.google.common.flogger.GoogleLogger;
import com.jpexs.decompiler.restructure.region.BlockRegion;
import com.jpexs.decompiler.restructure.region.BranchRegion;
import com.jpexs.decompiler.restructure.region.LoopRegion;
import com.jpexs.decompiler.restructure.region.Region;
import com.jpexs.decompiler.restructure.region.SequenceRegion;
import com.jpexs.decompiler.restructure.structure.BranchStructure;
import com.jpexs.decompiler.restructure.structure.LoopStructure;
import java.util.*;
import java.util.function.Supplier;

/**
 * Structures an acyclic graph view into sequences and branches.
 *
 * <p>Every loop of the view counts as one unit represented by its header, leaving through its latch.
 * Arm of a branch = units dominated by the arm target, when the branch is the only way in.
 * Several edges of the branch leading to the same target share one arm when the arms
 * would otherwise continue at different nodes. Arms continuing at different nodes get a branch join.
 *
 * <p>The dominator tree of the units is computed once per view. Inserting a branch join
 * keeps the dominance between the units after the branch, so the tree stays valid.
 *
 * @author JPEXS
 */
final class BranchRestructurer {

    private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

    private final Restructurer restructurer;

    BranchRestructurer(Restructurer restructurer) {
        this.restructurer = restructurer;
    }

    /**
     * Schedules structuring of the view after its loops were restructured.
     *
     * @param view the view
     * @param loops loops of the view
     * @param sink node that must stay at the end of the view (latch of the enclosing loop), or null
     * @param slot receives the region of the view
     */
    void structure(GraphView view, List<LoopStructure> loops, Node sink, RegionSlot slot) {
        Walker walker = new Walker(view, loops, sink);
        restructurer.schedule(walker.start(slot));
    }

    private static TreeSet<Node> unitsOf(GraphView view, List<LoopStructure> loops) {
        TreeSet<Node> units = new TreeSet<>(Node.INDEX_ORDER);
        units.addAll(view.getNodes());
        for (LoopStructure loop : loops) {
            units.removeAll(loop.body);
            units.add(loop.header);
        }
        return units;
    }

    private final class Walker {

        private final GraphView view;
        private final Node sink;
        private final Map<Node, LoopStructure> loopByHeader = new HashMap<>();
        private final Map<Node, LoopStructure> loopByMember = new HashMap<>();
        private final Map<Node, Node> unitByLatch = new HashMap<>();
        private final TreeSet<Node> units;
        private final DominatorTree dominators;
        private final Map<Node, List<Node>> predecessors = new HashMap<>();

        Walker(GraphView view, List<LoopStructure> loops, Node sink) {
            this.view = view;
            this.sink = sink;
            for (LoopStructure loop : loops) {
                loopByHeader.put(loop.header, loop);
                unitByLatch.put(loop.latch, loop.header);
                for (Node member : loop.body) {
                    loopByMember.put(member, loop);
                }
            }
            units = unitsOf(view, loops);
            dominators = new DominatorTree(view.getEntry(), units, unit -> getUnitSuccessors(unit, units));
            for (Node unit : units) {
                predecessors.put(unit, new ArrayList<>(dominators.getPredecessors(unit)));
            }
        }

        Walk start(RegionSlot slot) {
            return new Walk(units, view.getEntry(), slot);
        }

        /**
         * Gets the unit a node belongs to.
         *
         * @param node the node
         * @return the unit, or null if the node is outside of the view
         */
        private Node unitOf(Node node) {
            if (!view.contains(node)) {
                return null;
            }
            LoopStructure loop = loopByMember.get(node);
            if (loop == null) {
                return node;
            }
            if (loop.header != node) {
                throw new StructuringInvariantViolationException("Edge into loop " + loop.header + " enters at " + node);
            }
            return node;
        }

        private Node sourceUnit(EdgeRef ref) {
            Node unit = unitByLatch.get(ref.source);
            return unit != null ? unit : ref.source;
        }

        /**
         * Gets the edges by which control leaves a unit: the forward edges of its latch for a loop,
         * its own forward edges for a block.
         */
        private List<EdgeRef> getTransfers(Node unit) {
            LoopStructure loop = loopByHeader.get(unit);
            Node source = loop != null ? loop.latch : unit;
            List<EdgeRef> ret = new ArrayList<>();
            List<Edge> succs = source.getSuccessors();
            for (int i = 0; i < succs.size(); i++) {
                if (!succs.get(i).isBackEdge()) {
                    ret.add(new EdgeRef(source, i));
                }
            }
            return ret;
        }

        private Node targetUnit(EdgeRef ref, Set<Node> units) {
            Node unit = unitOf(ref.getTarget());
            if (unit == null || !units.contains(unit)) {
                return null;
            }
            return unit;
        }

        private List<Node> getUnitSuccessors(Node unit, Set<Node> units) {
            List<Node> ret = new ArrayList<>();
            for (EdgeRef ref : getTransfers(unit)) {
                Node target = targetUnit(ref, units);
                if (target != null) {
                    ret.add(target);
                }
            }
            return ret;
        }

        private List<EdgeRef> getEdgesLeaving(Set<Node> units) {
            List<EdgeRef> ret = new ArrayList<>();
            for (Node unit : units) {
                for (EdgeRef ref : getTransfers(unit)) {
                    if (targetUnit(ref, units) == null) {
                        ret.add(ref);
                    }
                }
            }
            return ret;
        }

        /**
         * Checks whether an edge target can start an arm of its own.
         *
         * @param target the target unit, null when outside of the walked units
         * @param edgeCounts number of discriminator edges per target unit
         * @param shared whether the target may be entered by several edges of the discriminator
         */
        private boolean formsArm(Node target, Map<Node, Integer> edgeCounts, boolean shared) {
            if (target == null || target == sink) {
                return false;
            }
            int inDegree = predecessors.get(target).size();
            if (shared) {
                return inDegree == edgeCounts.get(target);
            }
            return inDegree == 1;
        }

        /**
         * Walk over units dominated by its head, producing a sequence.
         * At a loop or a branch the walk schedules the inner parts and itself, then stops;
         * it resumes after the inner parts are structured.
         */
        private final class Walk implements Runnable {

            private final TreeSet<Node> remaining = new TreeSet<>(Node.INDEX_ORDER);
            private final Node head;
            private final RegionSlot slot;
            private final List<Supplier<Region>> parts = new ArrayList<>();
            private Node current;

            Walk(Set<Node> units, Node head, RegionSlot slot) {
                remaining.addAll(units);
                this.head = head;
                this.slot = slot;
                this.current = head;
            }

            @Override
            public void run() {
                while (current != null) {
                    LoopStructure loop = loopByHeader.get(current);
                    if (loop != null) {
                        RegionSlot body = new RegionSlot();
                        parts.add(() -> new LoopRegion(body.get(), loop.header, loop.latch));
                        advance();
                        restructurer.schedule(this);
                        restructurer.scheduleLevel(loop.body, loop.header, loop.latch, body);
                        return;
                    }
                    List<EdgeRef> transfers = getTransfers(current);
                    if (transfers.size() < 2 || getUnitSuccessors(current, remaining).isEmpty()) {
                        BlockRegion block = new BlockRegion(current);
                        parts.add(() -> block);
                        advance();
                    } else {
                        branch(transfers);
                        return;
                    }
                }
                finish();
            }

            private void advance() {
                remaining.remove(current);
                TreeSet<Node> next = new TreeSet<>(Node.INDEX_ORDER);
                next.addAll(getUnitSuccessors(current, remaining));
                if (next.size() > 1) {
                    throw new StructuringInvariantViolationException("Unit " + current + " continues at " + next);
                }
                current = next.isEmpty() ? null : next.first();
            }

            private void finish() {
                if (!remaining.isEmpty()) {
                    throw new StructuringInvariantViolationException("Units " + remaining + " not reached from " + head);
                }
                List<Region> sequence = new ArrayList<>();
                for (Supplier<Region> part : parts) {
                    sequence.add(part.get());
                }
                slot.set(sequence.size() == 1 ? sequence.get(0) : new SequenceRegion(sequence));
            }

            /**
             * Structures the branch at the current unit. Its arms are scheduled,
             * the walk continues at the merge unit afterwards.
             */
            private void branch(List<EdgeRef> transfers) {
                Node discriminator = current;
                int edgeCount = transfers.size();
                Node[] targets = new Node[edgeCount];
                Map<Node, Integer> edgeCounts = new HashMap<>();
                for (int i = 0; i < edgeCount; i++) {
                    targets[i] = targetUnit(transfers.get(i), remaining);
                    if (targets[i] != null) {
                        edgeCounts.merge(targets[i], 1, Integer::sum);
                    }
                }

                Node[] armHeads = new Node[edgeCount];
                for (int i = 0; i < edgeCount; i++) {
                    if (formsArm(targets[i], edgeCounts, false)) {
                        armHeads[i] = targets[i];
                    }
                }
                Map<Node, TreeSet<Node>> armSets = collectArms(armHeads);
                List<EdgeRef> joinEdges = collectJoinEdges(transfers, armHeads, armSets);
                if (countTargets(joinEdges) > 1) {
                    for (int i = 0; i < edgeCount; i++) {
                        if (armHeads[i] == null && formsArm(targets[i], edgeCounts, true)) {
                            armHeads[i] = targets[i];
                        }
                    }
                    armSets = collectArms(armHeads);
                    joinEdges = collectJoinEdges(transfers, armHeads, armSets);
                }
                TreeSet<Node> joinTargets = new TreeSet<>(Node.INDEX_ORDER);
                for (EdgeRef ref : joinEdges) {
                    joinTargets.add(ref.getTarget());
                }
                if (armSets.isEmpty() && joinTargets.size() > 1) {
                    throw new StructuringInvariantViolationException("Branch " + discriminator
                            + " has no arm of its own and continues at " + joinTargets);
                }

                remaining.remove(discriminator);
                for (TreeSet<Node> arm : armSets.values()) {
                    remaining.removeAll(arm);
                }

                Node branchJoin = null;
                Node merge = null;
                if (joinTargets.size() > 1) {
                    logger.atFine().log("Arms of %s continue at %s", discriminator, joinTargets);
                    branchJoin = insertJoin(joinEdges);
                    remaining.add(branchJoin);
                    merge = branchJoin;
                } else if (joinTargets.size() == 1) {
                    merge = joinTargets.first();
                }

                List<RegionSlot> armSlots = new ArrayList<>();
                List<Integer> edgeArms = new ArrayList<>();
                Map<Node, Integer> armIndexByHead = new HashMap<>();
                List<Walk> armWalks = new ArrayList<>();
                for (int i = 0; i < edgeCount; i++) {
                    Node armHead = armHeads[i];
                    if (armHead != null && armIndexByHead.containsKey(armHead)) {
                        edgeArms.add(armIndexByHead.get(armHead));
                        continue;
                    }
                    RegionSlot armSlot = new RegionSlot();
                    if (armHead == null) {
                        armSlot.set(SequenceRegion.empty());
                    } else {
                        armIndexByHead.put(armHead, armSlots.size());
                        armWalks.add(new Walk(armSets.get(armHead), armHead, armSlot));
                    }
                    edgeArms.add(armSlots.size());
                    armSlots.add(armSlot);
                }
                restructurer.recordBranch(new BranchStructure(discriminator, Arrays.asList(armHeads), merge, branchJoin));
                parts.add(() -> {
                    List<Region> arms = new ArrayList<>();
                    for (RegionSlot armSlot : armSlots) {
                        arms.add(armSlot.get());
                    }
                    return new BranchRegion(new BlockRegion(discriminator), arms, edgeArms);
                });

                Node mergeUnit = merge == null ? null : unitOf(merge);
                if (mergeUnit == null || !remaining.contains(mergeUnit)) {
                    if (!remaining.isEmpty()) {
                        throw new StructuringInvariantViolationException("Branch " + discriminator + " leaves to " + merge
                                + " before reaching " + remaining);
                    }
                    current = null;
                } else {
                    current = mergeUnit;
                }
                restructurer.schedule(this);
                for (int i = armWalks.size() - 1; i >= 0; i--) {
                    restructurer.schedule(armWalks.get(i));
                }
            }

            /**
             * Collects the units of each arm, by arm head. The sink never belongs to an arm.
             */
            private Map<Node, TreeSet<Node>> collectArms(Node[] armHeads) {
                Map<Node, TreeSet<Node>> ret = new LinkedHashMap<>();
                for (Node armHead : armHeads) {
                    if (armHead == null || ret.containsKey(armHead)) {
                        continue;
                    }
                    TreeSet<Node> arm = new TreeSet<>(Node.INDEX_ORDER);
                    arm.add(armHead);
                    for (Node unit : dominators.getDominatedBy(armHead)) {
                        if (unit != sink && remaining.contains(unit)) {
                            arm.add(unit);
                        }
                    }
                    ret.put(armHead, arm);
                }
                return ret;
            }

            /**
             * Collects the edges continuing after the branch: edges of empty arms and edges leaving the arms.
             */
            private List<EdgeRef> collectJoinEdges(List<EdgeRef> transfers, Node[] armHeads, Map<Node, TreeSet<Node>> armSets) {
                List<EdgeRef> ret = new ArrayList<>();
                Set<Node> done = new HashSet<>();
                for (int i = 0; i < armHeads.length; i++) {
                    if (armHeads[i] == null) {
                        ret.add(transfers.get(i));
                    } else if (done.add(armHeads[i])) {
                        ret.addAll(getEdgesLeaving(armSets.get(armHeads[i])));
                    }
                }
                return ret;
            }

            private int countTargets(List<EdgeRef> edges) {
                Set<Node> ret = new HashSet<>();
                for (EdgeRef ref : edges) {
                    ret.add(ref.getTarget());
                }
                return ret.size();
            }

            /**
             * Inserts a branch join collecting the edges and moves their predecessor entries to it.
             */
            private Node insertJoin(List<EdgeRef> joinEdges) {
                List<Node> sources = new ArrayList<>();
                for (EdgeRef ref : joinEdges) {
                    Node source = sourceUnit(ref);
                    Node target = unitOf(ref.getTarget());
                    if (target != null && predecessors.containsKey(target)) {
                        predecessors.get(target).remove(source);
                    }
                    sources.add(source);
                }
                Node branchJoin = restructurer.insertDispatch(NodeRole.BRANCH_JOIN, joinEdges, Restructurer.DESTINATION_ORDER);
                view.add(branchJoin);
                predecessors.put(branchJoin, sources);
                for (Edge edge : branchJoin.getSuccessors()) {
                    Node target = unitOf(edge.getTarget());
                    if (target != null && predecessors.containsKey(target)) {
                        predecessors.get(target).add(branchJoin);
                    }
                }
                return branchJoin;
            }
        }
    }
}
