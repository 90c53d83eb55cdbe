package com.jpexs.decompiler.restructure;

/**
 * Reference to one outgoing edge of a node, by position in its successor list.
 * Positions never change during restructuring, edges are only replaced in place.
 *
 * @author JPEXS
 */
final class EdgeRef {

    final Node source;
    final int position;

    EdgeRef(Node source, int position) {
        this.source = source;
        this.position = position;
    }

    Edge getEdge() {
        return source.getSuccessors().get(position);
    }

    Node getTarget() {
        return getEdge().getTarget();
    }

    void redirect(Edge edge) {
        source.setEdge(position, edge);
    }

    @Override
    public String toString() {
        return source + " " + getEdge();
    }
}
