package org.javai.failover.boundary;

import org.javai.failover.GatewayRequest;

import java.util.concurrent.CompletableFuture;

/**
 * Performs exactly one network attempt against one gateway. Implementations never retry.
 *
 * <p>The returned future completes normally with a classified outcome for every network or
 * protocol problem; it completes exceptionally only for defects.
 */
@FunctionalInterface
public interface RequestExecutor {

    /**
     * Sends {@code request} to {@code gatewayUrl} once.
     *
     * @param gatewayUrl the gateway endpoint
     * @param request the call to send
     * @return the classified outcome of the attempt
     */
    CompletableFuture<AttemptOutcome> execute(String gatewayUrl, GatewayRequest request);
}
