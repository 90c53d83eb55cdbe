package com.jpexs.decompiler.restructure;

/**
 * Thrown when restructuring did not end in a single-entry/single-exit region tree.
 * This is a defect, the same input always fails the same way.
 *
 * @author JPEXS
 */
public class StructuringInvariantViolationException extends RestructureException {

    public StructuringInvariantViolationException(String message) {
        super(message);
    }
}
