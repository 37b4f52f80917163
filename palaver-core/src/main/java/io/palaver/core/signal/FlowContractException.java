package io.palaver.core.signal;

/**
 * A programming error in flow or pipeline code. Never converted into a user-facing response.
 */
public final class FlowContractException extends RuntimeException {

    public FlowContractException(String message) {
        super(message);
    }

    public FlowContractException(String message, Throwable cause) {
        super(message, cause);
    }
}
