package io.palaver.cli;

@FunctionalInterface
public interface GatewayRunner {
    /**
     * Runs the gateway until the process is stopped.
     *
     * @param hostOverride host to bind, {@code null} for the configured one
     * @param portOverride port to bind, {@code null} for the configured one
     */
    int run(String hostOverride, Integer portOverride) throws Exception;
}
