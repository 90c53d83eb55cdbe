package com.jpexs.decompiler.restructure;

/**
 * Role of a Node in the restructured graph.
 * Every role except ORIGINAL marks a synthetic dispatch node inserted by restructuring.
 *
 * @author JPEXS
 */
public enum NodeRole {
    /**
     * Node supplied by the caller.
     */
    ORIGINAL("original"),
    /**
     * Single entry of a formerly irreducible loop, dispatches to the original headers.
     */
    DISPATCH_HEAD("dispatch_head"),
    /**
     * Single continuation of a loop with several exit targets, dispatches to them.
     */
    EXIT_LATCH("exit_latch"),
    /**
     * Tail of a loop body, selects between repeating the loop and leaving it.
     */
    LOOP_LATCH("loop_latch"),
    /**
     * Merge point of branch arms that would otherwise continue at different nodes.
     */
    BRANCH_JOIN("branch_join");

    private final String attributeValue;

    NodeRole(String attributeValue) {
        this.attributeValue = attributeValue;
    }

    public boolean isSynthetic() {
        return this != ORIGINAL;
    }

    /**
     * Gets the value used for the role attribute in Graphviz/DOT output.
     *
     * @return the attribute value
     */
    public String getAttributeValue() {
        return attributeValue;
    }

    /**
     * Finds a role by its Graphviz/DOT attribute value.
     *
     * @param value the attribute value
     * @return the role, or null if unknown
     */
    public static NodeRole fromAttributeValue(String value) {
        for (NodeRole role : values()) {
            if (role.attributeValue.equals(value)) {
                return role;
            }
        }
        return null;
    }
}
