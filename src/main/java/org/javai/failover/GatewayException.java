package org.javai.failover;

/**
 * Thrown when {@link Outcome#getOrThrow()} is called on a failed outcome.
 * This is an unchecked exception because it indicates the caller chose not to inspect the
 * outcome first.
 */
public class GatewayException extends RuntimeException {

    private final GatewayError error;

    public GatewayException(GatewayError error) {
        super(error.technicalMessage());
        this.error = error;
    }

    public GatewayError error() {
        return error;
    }
}
