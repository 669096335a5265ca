package com.aegis.governance.detection;

import java.util.concurrent.CompletableFuture;

/**
 * Lightweight liveness probe of one dependency, supplied by the host application.
 * <p>
 * Example:
 * <pre>{@code
 * HealthProbe postgres = () -> CompletableFuture.supplyAsync(() -> {
 *     long start = System.currentTimeMillis();
 *     try (Connection c = dataSource.getConnection()) {
 *         c.isValid(2);
 *         return ProbeResult.healthy(System.currentTimeMillis() - start);
 *     } catch (SQLException e) {
 *         return ProbeResult.unhealthy(e.getMessage(), System.currentTimeMillis() - start);
 *     }
 * });
 * }</pre>
 */
@FunctionalInterface
public interface HealthProbe {

    /**
     * Probes the dependency.
     *
     * @return a future that completes with the probe result
     */
    CompletableFuture<ProbeResult> probe();
}
