package com.starkiller.core.events;

/**
 * Thrown when a step that must not nest (recording a decision, processing a day)
 * is invoked while it is already running, typically from one of its own events.
 */
public class ReentrancyViolationException extends IllegalStateException {

    public ReentrancyViolationException(String message) {
        super(message);
    }
}
