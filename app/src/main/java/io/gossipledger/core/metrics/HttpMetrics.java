package io.gossipledger.core.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

/** Per-route timers for the operator API, tagged with the status class of the reply. */
public final class HttpMetrics {
    private static final MeterRegistry REGISTRY = LedgerMetrics.registry();

    private HttpMetrics() {}

    public static Timer.Sample start() {
        return Timer.start(REGISTRY);
    }

    public static void stop(Timer.Sample sample, String method, String route, int status) {
        Timer timer = Timer
                .builder("ledger.api.requests")
                .description("Operator API request duration")
                .tag("method", method)
                .tag("route", route)
                .tag("outcome", outcome(status))
                .register(REGISTRY);
        sample.stop(timer);
        if (status == 401) {
            REGISTRY.counter("ledger.api.unauthorized", "route", route).increment();
        }
    }

    static String outcome(int status) {
        if (status >= 500) return "server_error";
        if (status >= 400) return "client_error";
        return "success";
    }
}
