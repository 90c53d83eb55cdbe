package com.jpexs.decompiler.restructure;

import java.util.*;
import java.util.function.Function;

/**
 * Dominator tree of an acyclic graph.
 * A node D dominates node N if every path from entry to N goes through D.
 * Construction fails when the graph has a cycle or a node not reachable from the entry.
 *
 * <p>Immediate dominators are computed by the iterative algorithm of Cooper, Harvey and Kennedy
 * over the reverse post order; the depth-first search keeps its own stack.
 *
 * @author JPEXS
 */
final class DominatorTree {

    private final Node entry;
    private final Function<Node, List<Node>> successors;
    private final List<Node> reversePostOrder = new ArrayList<>();
    private final Map<Node, Integer> postOrderNumber = new HashMap<>();
    private final Map<Node, List<Node>> predecessors = new HashMap<>();
    private final Map<Node, Node> immediateDominators = new HashMap<>();
    private final Map<Node, List<Node>> children = new HashMap<>();

    /**
     * Computes dominators.
     *
     * @param entry the entry node
     * @param nodes all nodes of the graph
     * @param successors successors of a node, restricted to the graph
     * @throws StructuringInvariantViolationException if the graph is cyclic or not connected
     */
    DominatorTree(Node entry, Collection<Node> nodes, Function<Node, List<Node>> successors) {
        this.entry = entry;
        this.successors = successors;
        computeReversePostOrder();
        if (reversePostOrder.size() != nodes.size()) {
            Set<Node> unreachable = new TreeSet<>(Node.INDEX_ORDER);
            unreachable.addAll(nodes);
            unreachable.removeAll(reversePostOrder);
            throw new StructuringInvariantViolationException("Nodes " + unreachable + " are not reachable from " + entry);
        }
        computeImmediateDominators();
    }

    private static final class Frame {

        final Node node;
        final Iterator<Node> successors;

        Frame(Node node, Iterator<Node> successors) {
            this.node = node;
            this.successors = successors;
        }
    }

    private Frame open(Node node, Set<Node> visited, Set<Node> active) {
        visited.add(node);
        active.add(node);
        predecessors.putIfAbsent(node, new ArrayList<>());
        return new Frame(node, successors.apply(node).iterator());
    }

    private void computeReversePostOrder() {
        Set<Node> visited = new HashSet<>();
        Set<Node> active = new HashSet<>();
        List<Node> postOrder = new ArrayList<>();
        Deque<Frame> frames = new ArrayDeque<>();
        frames.push(open(entry, visited, active));
        while (!frames.isEmpty()) {
            Frame frame = frames.peek();
            if (frame.successors.hasNext()) {
                Node succ = frame.successors.next();
                predecessors.computeIfAbsent(succ, k -> new ArrayList<>()).add(frame.node);
                if (active.contains(succ)) {
                    throw new StructuringInvariantViolationException("Unexpected cycle through " + frame.node + " -> " + succ
                            + " after loop restructuring");
                }
                if (!visited.contains(succ)) {
                    frames.push(open(succ, visited, active));
                }
                continue;
            }
            frames.pop();
            active.remove(frame.node);
            postOrderNumber.put(frame.node, postOrder.size());
            postOrder.add(frame.node);
        }
        for (int i = postOrder.size() - 1; i >= 0; i--) {
            reversePostOrder.add(postOrder.get(i));
        }
    }

    private void computeImmediateDominators() {
        immediateDominators.put(entry, entry);
        boolean changed = true;
        while (changed) {
            changed = false;
            for (Node node : reversePostOrder) {
                if (node == entry) {
                    continue;
                }
                Node newIdom = null;
                for (Node pred : predecessors.get(node)) {
                    if (!immediateDominators.containsKey(pred)) {
                        continue;
                    }
                    newIdom = newIdom == null ? pred : intersect(pred, newIdom);
                }
                if (newIdom != immediateDominators.get(node)) {
                    immediateDominators.put(node, newIdom);
                    changed = true;
                }
            }
        }
        for (Node node : reversePostOrder) {
            children.put(node, new ArrayList<>());
        }
        for (Node node : reversePostOrder) {
            if (node != entry) {
                children.get(immediateDominators.get(node)).add(node);
            }
        }
    }

    private Node intersect(Node a, Node b) {
        while (a != b) {
            while (postOrderNumber.get(a) < postOrderNumber.get(b)) {
                a = immediateDominators.get(a);
            }
            while (postOrderNumber.get(b) < postOrderNumber.get(a)) {
                b = immediateDominators.get(b);
            }
        }
        return a;
    }

    List<Node> getReversePostOrder() {
        return Collections.unmodifiableList(reversePostOrder);
    }

    boolean dominates(Node dominator, Node node) {
        if (!immediateDominators.containsKey(node)) {
            return false;
        }
        Node current = node;
        while (current != dominator) {
            if (current == entry) {
                return false;
            }
            current = immediateDominators.get(current);
        }
        return true;
    }

    /**
     * Gets the closest strict dominator of a node.
     *
     * @param node the node
     * @return the immediate dominator, or null for the entry
     */
    Node getImmediateDominator(Node node) {
        if (node == entry) {
            return null;
        }
        return immediateDominators.get(node);
    }

    /**
     * Gets all nodes dominated by the given node, itself included.
     *
     * @param dominator the dominating node
     * @return the dominated nodes, ordered by arena index
     */
    Set<Node> getDominatedBy(Node dominator) {
        Set<Node> ret = new TreeSet<>(Node.INDEX_ORDER);
        if (!children.containsKey(dominator)) {
            return ret;
        }
        Deque<Node> todo = new ArrayDeque<>();
        todo.push(dominator);
        while (!todo.isEmpty()) {
            Node node = todo.pop();
            ret.add(node);
            for (Node child : children.get(node)) {
                todo.push(child);
            }
        }
        return ret;
    }

    /**
     * Gets the predecessors of a node, one per edge.
     *
     * @param node the node
     * @return the predecessors, duplicates included
     */
    List<Node> getPredecessors(Node node) {
        List<Node> preds = predecessors.get(node);
        return preds == null ? Collections.emptyList() : Collections.unmodifiableList(preds);
    }

    /**
     * Gets the number of edges entering a node, duplicates counted.
     *
     * @param node the node
     * @return the in-degree
     */
    int getInDegree(Node node) {
        return getPredecessors(node).size();
    }
}
