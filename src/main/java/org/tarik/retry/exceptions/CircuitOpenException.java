package org.tarik.retry.exceptions;

import org.tarik.retry.strategies.circuit.CircuitState;

/**
 * Exception produced when a circuit breaker refuses an attempt. The operation isn't invoked in this case.
 */
public class CircuitOpenException extends RuntimeException {
    private final String circuitName;
    private final CircuitState state;

    public CircuitOpenException(String circuitName, CircuitState state) {
        super("Circuit breaker '%s' refused the attempt because it is %s".formatted(circuitName, state.getLabel()));
        this.circuitName = circuitName;
        this.state = state;
    }

    public String getCircuitName() {
        return circuitName;
    }

    public CircuitState getState() {
        return state;
    }
}
