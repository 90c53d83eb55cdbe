package com.jpexs.decompiler.restructure;

/**
 * Base of all errors reported by restructuring.
 *
 * @author JPEXS
 */
public class RestructureException extends RuntimeException {

    public RestructureException(String message) {
        super(message);
    }

    public RestructureException(String message, Throwable cause) {
        super(message, cause);
    }
}
