package com.jpexs.decompiler.restructure;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Node of Control Flow Graph (CFG), one basic block.
 * The order of successors is the order of branch arms in the structured output.
 *
 * @author JPEXS
 */
public class Node {

    /**
     * Orders nodes by arena index: declaration order, then creation order of synthetic nodes.
     */
    public static final Comparator<Node> INDEX_ORDER = Comparator.comparingInt(Node::getIndex);

    private final String label;
    private final NodeRole role;
    private Object payload;
    private final List<Edge> succs = new ArrayList<>();
    private int index = -1;

    public Node(String label) {
        this(label, NodeRole.ORIGINAL, null);
    }

    public Node(String label, Object payload) {
        this(label, NodeRole.ORIGINAL, payload);
    }

    public Node(String label, NodeRole role, Object payload) {
        if (label == null || label.isEmpty()) {
            throw new IllegalArgumentException("Node label must not be empty");
        }
        if (role == null) {
            throw new IllegalArgumentException("Node role must not be null");
        }
        this.label = label;
        this.role = role;
        this.payload = payload;
    }

    public String getLabel() {
        return label;
    }

    public NodeRole getRole() {
        return role;
    }

    public boolean isSynthetic() {
        return role.isSynthetic();
    }

    /**
     * Gets the caller supplied data of this node (instructions etc.).
     *
     * @return the payload, or null
     */
    public Object getPayload() {
        return payload;
    }

    public void setPayload(Object payload) {
        this.payload = payload;
    }

    /**
     * Gets the position of this node in the arena of a restructuring run.
     * Nodes created by the caller have index -1.
     *
     * @return the arena index
     */
    public int getIndex() {
        return index;
    }

    void setIndex(int index) {
        this.index = index;
    }

    /**
     * Appends an edge to the given node.
     *
     * @param succ the successor
     * @return this node
     */
    public Node addSuccessor(Node succ) {
        succs.add(new Edge(succ));
        return this;
    }

    /**
     * Appends an edge carrying a case value to the given synthetic node.
     *
     * @param succ the successor
     * @param caseValue the case value
     * @return this node
     */
    public Node addSuccessor(Node succ, int caseValue) {
        succs.add(new Edge(succ, caseValue));
        return this;
    }

    void addEdge(Edge edge) {
        succs.add(edge);
    }

    void setEdge(int position, Edge edge) {
        succs.set(position, edge);
    }

    public List<Edge> getSuccessors() {
        return Collections.unmodifiableList(succs);
    }

    /**
     * Gets the targets of all edges, in edge order.
     *
     * @return the successor nodes
     */
    public List<Node> getSuccessorNodes() {
        List<Node> ret = new ArrayList<>();
        for (Edge edge : succs) {
            ret.add(edge.getTarget());
        }
        return ret;
    }

    /**
     * Gets the edges that are not back edges, in edge order.
     *
     * @return the forward edges
     */
    public List<Edge> getForwardEdges() {
        List<Edge> ret = new ArrayList<>();
        for (Edge edge : succs) {
            if (!edge.isBackEdge()) {
                ret.add(edge);
            }
        }
        return ret;
    }

    /**
     * Gets the successor selected by the given case value of this synthetic node.
     *
     * @param caseValue the case value
     * @return the successor edge
     * @throws IllegalArgumentException if the node has no successor for the case value
     */
    public Edge getCaseEdge(int caseValue) {
        if (!isSynthetic()) {
            throw new IllegalStateException("Node " + label + " is not a synthetic dispatch node");
        }
        if (caseValue < 0 || caseValue >= succs.size()) {
            throw new IllegalArgumentException("Node " + label + " has no case " + caseValue + ", cases are 0.." + (succs.size() - 1));
        }
        return succs.get(caseValue);
    }

    public boolean isBranch() {
        return getForwardEdges().size() > 1;
    }

    public boolean isTerminal() {
        return succs.isEmpty();
    }

    @Override
    public String toString() {
        return label;
    }
}
