package com.jpexs.decompiler.restructure;

/**
 * Thrown when the input graph is not well formed:
 * an edge leads to an unknown node, labels are not unique,
 * or no single entry can be determined.
 *
 * @author JPEXS
 */
public class MalformedGraphException extends RestructureException {

    public MalformedGraphException(String message) {
        super(message);
    }
}
