package com.jpexs.decompiler.restructure;

import com.google.common.flogger.GoogleLogger;
import com.jpexs.decompiler.restructure.region.Region;
import com.jpexs.decompiler.restructure.structure.BranchStructure;
import com.jpexs.decompiler.restructure.structure.LoopStructure;
import java.util.*;

/**
 * Restructures a Control Flow Graph (CFG) into a tree of single-entry/single-exit regions.
 * Capable of handling:
 * - Loops, including irreducible ones (several entries) and loops with several exits
 * - Multi-way branches, including arms that continue at different nodes
 * - Returns anywhere in the graph
 *
 * The input graph is never modified. Each instance works on its own arena of node copies,
 * synthetic nodes are numbered by a counter of the instance.
 * Nested loops and branches are structured by tasks on an explicit stack, not by recursion.
 *
 * @author JPEXS
 */
public class Restructurer {

    private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

    /**
     * Orders edge destinations by target arena index, then by case value.
     */
    static final Comparator<Edge> DESTINATION_ORDER = Comparator
            .comparingInt((Edge edge) -> edge.getTarget().getIndex())
            .thenComparingInt(Edge::getCaseValue);

    private final ControlFlowGraph graph;
    private final Node entryNode;
    private final boolean verify;
    private final List<Node> arena = new ArrayList<>();
    private final Set<String> usedLabels = new HashSet<>();
    private final List<LoopStructure> loops = new ArrayList<>();
    private final List<BranchStructure> branches = new ArrayList<>();
    private final LoopRestructurer loopRestructurer = new LoopRestructurer(this);
    private final BranchRestructurer branchRestructurer = new BranchRestructurer(this);
    private final Deque<Runnable> tasks = new ArrayDeque<>();
    private int syntheticCounter = 0;
    private int copiedCount = 0;
    private Region result;

    /**
     * Creates a new Restructurer for the given CFG, starting at its entry node.
     *
     * @param graph the CFG
     */
    public Restructurer(ControlFlowGraph graph) {
        this(graph, graph.getEntryNode(), true);
    }

    public Restructurer(ControlFlowGraph graph, boolean verify) {
        this(graph, graph.getEntryNode(), verify);
    }

    /**
     * Creates a new Restructurer for the given CFG.
     *
     * @param graph the CFG
     * @param entryNode the node to start at, must be part of the graph
     * @param verify whether to check the single-entry/single-exit shape of the result
     * @throws MalformedGraphException if the entry node is not part of the graph
     */
    public Restructurer(ControlFlowGraph graph, Node entryNode, boolean verify) {
        if (!graph.contains(entryNode)) {
            throw new MalformedGraphException("Entry node " + entryNode + " is not part of the graph");
        }
        this.graph = graph;
        this.entryNode = entryNode;
        this.verify = verify;
    }

    /**
     * Restructures the graph starting at its entry node.
     *
     * @param graph the CFG
     * @return the root region
     * @throws MalformedGraphException if the graph is malformed
     * @throws StructuringInvariantViolationException if restructuring failed
     */
    public static Region restructure(ControlFlowGraph graph) {
        return new Restructurer(graph).analyze();
    }

    /**
     * Restructures the graph starting at the given entry node.
     *
     * @param graph the CFG
     * @param entry the entry node
     * @return the root region
     * @throws MalformedGraphException if the graph is malformed
     * @throws StructuringInvariantViolationException if restructuring failed
     */
    public static Region restructure(ControlFlowGraph graph, Node entry) {
        return new Restructurer(graph, entry, true).analyze();
    }

    /**
     * Restructures the graph. Repeated calls return the same region tree;
     * after a failure the next call starts over.
     *
     * @return the root region
     */
    public Region analyze() {
        if (result != null) {
            return result;
        }
        reset();
        Node entry = copyReachableNodes();
        logger.atFine().log("Restructuring %d of %d nodes, entry %s", arena.size(), graph.size(), entry);

        RegionSlot rootSlot = new RegionSlot();
        scheduleLevel(arena, entry, null, rootSlot);
        while (!tasks.isEmpty()) {
            tasks.pop().run();
        }
        Region root = rootSlot.get();

        if (verify) {
            new RegionVerifier(arena).verify(root);
        }
        logger.atFine().log("Restructured into %d loops and %d branches, %d synthetic nodes",
                loops.size(), branches.size(), getSyntheticNodes().size());
        result = root;
        return root;
    }

    private void reset() {
        arena.clear();
        usedLabels.clear();
        loops.clear();
        branches.clear();
        tasks.clear();
        syntheticCounter = 0;
        copiedCount = 0;
    }

    /**
     * Copies the nodes reachable from the entry into the arena, in declaration order.
     * Back-edge flags of the input are dropped, case values and roles are kept.
     *
     * @return the copy of the entry node
     */
    private Node copyReachableNodes() {
        Set<Node> reachable = new HashSet<>(graph.getReachableNodes(entryNode));

        Map<Node, Node> copies = new LinkedHashMap<>();
        for (Node node : graph.getNodes()) {
            if (reachable.contains(node)) {
                Node copy = new Node(node.getLabel(), node.getRole(), node.getPayload());
                register(copy);
                copies.put(node, copy);
            } else {
                usedLabels.add(node.getLabel());
                logger.atFine().log("Dropping node %s, not reachable from %s", node, entryNode);
            }
        }
        copiedCount = arena.size();
        for (Map.Entry<Node, Node> entry : copies.entrySet()) {
            for (Edge edge : entry.getKey().getSuccessors()) {
                Node target = copies.get(edge.getTarget());
                if (target == null) {
                    throw new MalformedGraphException("Edge " + entry.getKey() + " -> " + edge.getTarget()
                            + " references a node that is not part of the graph");
                }
                if (edge.hasCaseValue() && (!target.isSynthetic() || edge.getCaseValue() < 0
                        || edge.getCaseValue() >= edge.getTarget().getSuccessors().size())) {
                    throw new MalformedGraphException("Edge " + entry.getKey() + " " + edge
                            + " has a case value not selecting a successor of a synthetic node");
                }
                entry.getValue().addEdge(new Edge(target, edge.getCaseValue()));
            }
        }
        return copies.get(entryNode);
    }

    private void register(Node node) {
        node.setIndex(arena.size());
        arena.add(node);
        usedLabels.add(node.getLabel());
    }

    /**
     * Schedules structuring of a single-entry node set: its loops are collapsed, then its branches.
     * All edges leaving the set must lead to one node, returns excepted.
     *
     * @param nodes the nodes
     * @param entry the entry of the set
     * @param latch latch of the loop whose body is structured, or null
     * @param slot receives the region of the set
     */
    void scheduleLevel(Collection<Node> nodes, Node entry, Node latch, RegionSlot slot) {
        schedule(() -> {
            GraphView view = new GraphView(nodes, entry);
            logger.atFinest().log("Structuring %s", view);
            List<LoopStructure> levelLoops = loopRestructurer.restructureLoops(view);
            loops.addAll(levelLoops);
            branchRestructurer.structure(view, levelLoops, latch, slot);
        });
    }

    /**
     * Schedules a task. The task scheduled last runs first, so work scheduled by a task
     * completes before the tasks scheduled earlier.
     *
     * @param task the task
     */
    void schedule(Runnable task) {
        tasks.push(task);
    }

    void recordBranch(BranchStructure branch) {
        logger.atFiner().log("%s", branch);
        branches.add(branch);
    }

    /**
     * Inserts a synthetic node collecting the given edges.
     * The distinct destinations (target, case value) of the edges become the successors
     * of the new node in the given order, each edge is redirected to the new node
     * with the position of its destination as case value.
     *
     * @param role role of the new node
     * @param edges the edges to redirect
     * @param order order of the destinations
     * @return the new node
     */
    Node insertDispatch(NodeRole role, List<EdgeRef> edges, Comparator<Edge> order) {
        List<Edge> destinations = new ArrayList<>();
        for (EdgeRef ref : edges) {
            Edge edge = ref.getEdge();
            if (indexOfDestination(destinations, edge) == -1) {
                destinations.add(new Edge(edge.getTarget(), edge.getCaseValue()));
            }
        }
        destinations.sort(order);

        Node dispatch = createSyntheticNode(role);
        for (Edge destination : destinations) {
            dispatch.addEdge(destination);
        }
        for (EdgeRef ref : edges) {
            ref.redirect(new Edge(dispatch, indexOfDestination(destinations, ref.getEdge())));
        }
        logger.atFine().log("Inserted %s collecting %d edges into %s", dispatch, edges.size(), destinations);
        return dispatch;
    }

    private static int indexOfDestination(List<Edge> destinations, Edge edge) {
        for (int i = 0; i < destinations.size(); i++) {
            if (destinations.get(i).sameDestination(edge)) {
                return i;
            }
        }
        return -1;
    }

    private Node createSyntheticNode(NodeRole role) {
        String label;
        do {
            label = getLabelPrefix(role) + "_" + syntheticCounter++;
        } while (usedLabels.contains(label));
        Node node = new Node(label, role, null);
        register(node);
        return node;
    }

    private static String getLabelPrefix(NodeRole role) {
        switch (role) {
            case DISPATCH_HEAD:
                return "synth_head";
            case EXIT_LATCH:
                return "synth_exit";
            case LOOP_LATCH:
                return "synth_latch";
            case BRANCH_JOIN:
                return "synth_join";
            default:
                throw new IllegalArgumentException("Not a synthetic role: " + role);
        }
    }

    public ControlFlowGraph getGraph() {
        return graph;
    }

    /**
     * Gets all nodes of the result: copies of the reachable input nodes and synthetic nodes.
     *
     * @return the nodes in arena order
     */
    public List<Node> getNodes() {
        return Collections.unmodifiableList(arena);
    }

    /**
     * Gets the nodes inserted by restructuring, in creation order.
     *
     * @return the synthetic nodes
     */
    public List<Node> getSyntheticNodes() {
        return Collections.unmodifiableList(arena.subList(copiedCount, arena.size()));
    }

    /**
     * Gets the loops found, outer loops before the loops of their bodies.
     *
     * @return the loops
     */
    public List<LoopStructure> getLoops() {
        return Collections.unmodifiableList(loops);
    }

    public List<BranchStructure> getBranches() {
        return Collections.unmodifiableList(branches);
    }
}
