package org.e2immu.analyzer.incremental.common;

/**
 * Thrown when the engine reaches a state that its own protocol rules out, e.g. walking a syntax tree
 * without a current analysis unit, or dequeuing a unit whose in-queue flag is not set.
 * This is never caused by bad input; it signals a defect, and is never caught by the engine.
 */
public class ProtocolViolationException extends RuntimeException {

    public ProtocolViolationException(String message) {
        super(message);
    }
}
