package com.jpexs.decompiler.restructure;

import java.util.*;

/**
 * Induced subgraph of the restructuring arena: a set of nodes and its entry.
 * Only edges whose both ends are in the set are internal; back edges are never internal.
 *
 * @author JPEXS
 */
final class GraphView {

    private final TreeSet<Node> nodes = new TreeSet<>(Node.INDEX_ORDER);
    private final Node entry;

    GraphView(Collection<Node> nodes, Node entry) {
        this.nodes.addAll(nodes);
        this.entry = entry;
        if (!this.nodes.contains(entry)) {
            throw new StructuringInvariantViolationException("Entry " + entry + " is not part of the view " + this.nodes);
        }
    }

    Node getEntry() {
        return entry;
    }

    boolean contains(Node node) {
        return nodes.contains(node);
    }

    void add(Node node) {
        nodes.add(node);
    }

    /**
     * Gets the nodes ordered by arena index.
     */
    List<Node> getNodes() {
        return new ArrayList<>(nodes);
    }

    /**
     * Gets internal successors of a node, in edge order, duplicates included.
     */
    List<Node> getInternalSuccessors(Node node) {
        List<Node> ret = new ArrayList<>();
        for (Edge edge : node.getSuccessors()) {
            if (!edge.isBackEdge() && nodes.contains(edge.getTarget())) {
                ret.add(edge.getTarget());
            }
        }
        return ret;
    }

    /**
     * Gets all forward edges of view nodes that enter one of the targets.
     */
    List<EdgeRef> getEdgesInto(Collection<Node> targets) {
        List<EdgeRef> ret = new ArrayList<>();
        for (Node node : nodes) {
            List<Edge> succs = node.getSuccessors();
            for (int i = 0; i < succs.size(); i++) {
                Edge edge = succs.get(i);
                if (!edge.isBackEdge() && targets.contains(edge.getTarget())) {
                    ret.add(new EdgeRef(node, i));
                }
            }
        }
        return ret;
    }

    /**
     * Gets the forward edges of the given nodes that lead outside of them.
     * The target may be a view node or lie outside the view.
     */
    static List<EdgeRef> getEdgesLeaving(Collection<Node> set) {
        List<Node> ordered = new ArrayList<>(set);
        ordered.sort(Node.INDEX_ORDER);
        List<EdgeRef> ret = new ArrayList<>();
        for (Node node : ordered) {
            List<Edge> succs = node.getSuccessors();
            for (int i = 0; i < succs.size(); i++) {
                Edge edge = succs.get(i);
                if (!edge.isBackEdge() && !set.contains(edge.getTarget())) {
                    ret.add(new EdgeRef(node, i));
                }
            }
        }
        return ret;
    }

    /**
     * Finds the headers of a node set: members entered from a view node outside the set,
     * plus the view entry when it is a member.
     */
    List<Node> findHeaders(Set<Node> set) {
        TreeSet<Node> headers = new TreeSet<>(Node.INDEX_ORDER);
        if (set.contains(entry)) {
            headers.add(entry);
        }
        for (Node node : nodes) {
            if (set.contains(node)) {
                continue;
            }
            for (Node succ : getInternalSuccessors(node)) {
                if (set.contains(succ)) {
                    headers.add(succ);
                }
            }
        }
        return new ArrayList<>(headers);
    }

    /**
     * Finds the entries of a node set: view nodes outside the set with an edge into it.
     */
    List<Node> findEntries(Set<Node> set) {
        List<Node> ret = new ArrayList<>();
        for (Node node : nodes) {
            if (set.contains(node)) {
                continue;
            }
            for (Node succ : getInternalSuccessors(node)) {
                if (set.contains(succ)) {
                    ret.add(node);
                    break;
                }
            }
        }
        return ret;
    }

    /**
     * Finds the exit targets of a node set: distinct targets of edges leaving it, ordered by arena index.
     */
    static List<Node> findExitTargets(Collection<Node> set) {
        TreeSet<Node> ret = new TreeSet<>(Node.INDEX_ORDER);
        for (EdgeRef ref : getEdgesLeaving(set)) {
            ret.add(ref.getTarget());
        }
        return new ArrayList<>(ret);
    }

    /**
     * Finds the exiting nodes of a node set: members with an edge leaving it.
     */
    static List<Node> findExitingNodes(Collection<Node> set) {
        TreeSet<Node> ret = new TreeSet<>(Node.INDEX_ORDER);
        for (EdgeRef ref : getEdgesLeaving(set)) {
            ret.add(ref.source);
        }
        return new ArrayList<>(ret);
    }

    @Override
    public String toString() {
        return "GraphView{entry=" + entry + ", nodes=" + nodes + "}";
    }
}
