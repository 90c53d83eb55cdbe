package com.jpexs.decompiler.restructure;

/**
 * Edge from one Node to another.
 * An edge entering a synthetic node carries the case value that selects
 * which successor of the synthetic node is taken.
 *
 * @author JPEXS
 */
public final class Edge {

    /**
     * Case value of an edge that does not enter a synthetic node.
     */
    public static final int NO_CASE = -1;

    private final Node target;
    private final int caseValue;
    private final boolean backEdge;

    public Edge(Node target) {
        this(target, NO_CASE, false);
    }

    public Edge(Node target, int caseValue) {
        this(target, caseValue, false);
    }

    public Edge(Node target, int caseValue, boolean backEdge) {
        if (target == null) {
            throw new IllegalArgumentException("Edge target must not be null");
        }
        this.target = target;
        this.caseValue = caseValue;
        this.backEdge = backEdge;
    }

    public Node getTarget() {
        return target;
    }

    public int getCaseValue() {
        return caseValue;
    }

    public boolean hasCaseValue() {
        return caseValue != NO_CASE;
    }

    /**
     * Checks whether this edge jumps back to the header of an enclosing loop.
     *
     * @return true for a back edge
     */
    public boolean isBackEdge() {
        return backEdge;
    }

    /**
     * Returns a copy of this edge with the back-edge flag set.
     *
     * @return the back edge
     */
    public Edge asBackEdge() {
        return new Edge(target, caseValue, true);
    }

    /**
     * Checks whether both edges lead to the same node with the same case value.
     *
     * @param other the other edge
     * @return true if the destinations are equal
     */
    public boolean sameDestination(Edge other) {
        return target == other.target && caseValue == other.caseValue;
    }

    @Override
    public String toString() {
        String ret = "-> " + target;
        if (hasCaseValue()) {
            ret += " [" + caseValue + "]";
        }
        if (backEdge) {
            ret += " (back)";
        }
        return ret;
    }
}
