package io.gossipledger.core.api;

import com.sun.net.httpserver.HttpExchange;
import io.gossipledger.core.metrics.LedgerMetrics;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

/** Writes the ledger meter registry as plain text. */
final class MetricsHandler {
    private MetricsHandler() {}

    static int respond(HttpExchange exchange) throws IOException {
        byte[] scrape = LedgerMetrics.scrapeMetrics().getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "text/plain; charset=utf-8");
        exchange.sendResponseHeaders(200, scrape.length);
        try (OutputStream body = exchange.getResponseBody()) {
            body.write(scrape);
        }
        return 200;
    }
}
