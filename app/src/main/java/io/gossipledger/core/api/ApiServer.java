package io.gossipledger.core.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import io.gossipledger.core.metrics.HttpMetrics;
import io.gossipledger.core.node.MinedBlock;
import io.gossipledger.core.node.Node;
import io.gossipledger.core.protocol.Block;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Operator REST API: inspect the ledger and peers, mine a block, trigger a chain sync.
 * Optional token auth via {@code Authorization: Bearer <token>} or {@code X-API-Key}.
 */
public class ApiServer {
    private static final Logger LOG = Logger.getLogger(ApiServer.class.getName());
    static final long DEFAULT_MINING_TIMEOUT_MS = 120_000L;
    private static final byte[] OPENAPI_SPEC = """
{
  "openapi": "3.0.3",
  "info": {
    "title": "Gossip Ledger REST API",
    "version": "1.0.0"
  },
  "paths": {
    "/chain": {
      "get": {
        "summary": "Return the full local ledger, genesis first",
        "responses": { "200": { "description": "Ledger" }, "401": { "description": "Auth required" } }
      }
    },
    "/peers": {
      "get": {
        "summary": "List peers in the active gossip group",
        "responses": { "200": { "description": "Peer list" }, "401": { "description": "Auth required" } }
      }
    },
    "/blocks": {
      "post": {
        "summary": "Mine a block carrying the given data and announce it",
        "requestBody": {
          "required": true,
          "content": {
            "application/json": {
              "schema": { "$ref": "#/components/schemas/CreateBlock" }
            }
          }
        },
        "responses": {
          "201": { "description": "Block mined and appended" },
          "400": { "description": "Missing or invalid parameters" },
          "409": { "description": "Mined block was rejected by the ledger" },
          "503": { "description": "Mining gave up or timed out" },
          "401": { "description": "Auth required" }
        }
      }
    },
    "/sync": {
      "post": {
        "summary": "Request the ledger of one peer, or of every active peer when no peer is given",
        "requestBody": {
          "required": false,
          "content": {
            "application/json": {
              "schema": { "$ref": "#/components/schemas/SyncRequest" }
            }
          }
        },
        "responses": { "202": { "description": "Request published" }, "401": { "description": "Auth required" } }
      }
    },
    "/metrics": {
      "get": {
        "summary": "Metrics scrape",
        "responses": { "200": { "description": "Metrics in text format" }, "401": { "description": "Auth required" } }
      }
    },
    "/openapi.json": {
      "get": {
        "summary": "Return this OpenAPI document",
        "responses": { "200": { "description": "OpenAPI specification" } }
      }
    }
  },
  "components": {
    "schemas": {
      "CreateBlock": {
        "type": "object",
        "required": ["data"],
        "properties": {
          "data": { "type": "string" }
        }
      },
      "SyncRequest": {
        "type": "object",
        "properties": {
          "peer": { "type": "string" }
        }
      }
    }
  }
}
""".getBytes(StandardCharsets.UTF_8);

    private final Node node;
    private final ObjectMapper mapper;
    private final String bindAddress;
    private final int port;
    private final String authToken;
    private final long miningTimeoutMillis;
    private HttpServer httpServer;
    private ExecutorService handlers;

    public ApiServer(Node node, String bindAddress, int port, String authToken) {
        this(node, bindAddress, port, authToken, DEFAULT_MINING_TIMEOUT_MS);
    }

    ApiServer(Node node, String bindAddress, int port, String authToken, long miningTimeoutMillis) {
        this.node = node;
        this.miningTimeoutMillis = miningTimeoutMillis;
        this.bindAddress = bindAddress == null || bindAddress.isBlank() ? "127.0.0.1" : bindAddress;
        this.port = port;
        this.authToken = authToken == null || authToken.isBlank() ? null : authToken;
        this.mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public void start() throws IOException {
        httpServer = HttpServer.create(new InetSocketAddress(bindAddress, port), 0);
        httpServer.createContext("/chain", new Route("GET", true, this::chain));
        httpServer.createContext("/peers", new Route("GET", true, this::peers));
        httpServer.createContext("/blocks", new Route("POST", true, this::createBlock));
        httpServer.createContext("/sync", new Route("POST", true, this::sync));
        httpServer.createContext("/metrics", new Route("GET", true, MetricsHandler::respond));
        httpServer.createContext("/openapi.json", new Route("GET", false, exchange -> sendJson(exchange, 200, OPENAPI_SPEC)));
        // POST /blocks waits for the miner, so handlers need their own threads
        handlers = Executors.newCachedThreadPool();
        httpServer.setExecutor(handlers);
        httpServer.start();
        LOG.info("Operator API listening on " + bindAddress + ":" + port + (authToken == null ? "" : " (token auth)"));
    }

    public void stop() {
        if (httpServer != null) {
            httpServer.stop(0);
            httpServer = null;
        }
        if (handlers != null) {
            handlers.shutdownNow();
            handlers = null;
        }
    }

    private int chain(HttpExchange exchange) throws IOException {
        List<Block> blocks = node.chain().snapshot();
        ObjectNode resp = mapper.createObjectNode();
        resp.put("height", blocks.isEmpty() ? -1 : blocks.get(blocks.size() - 1).id());
        resp.put("length", blocks.size());
        resp.set("blocks", mapper.valueToTree(blocks));
        return sendJson(exchange, 200, resp);
    }

    private int peers(HttpExchange exchange) throws IOException {
        ObjectNode resp = mapper.createObjectNode();
        resp.put("self", node.config().identity.value());
        ArrayNode peers = resp.putArray("peers");
        node.membership().activePeers().forEach(peers::add);
        return sendJson(exchange, 200, resp);
    }

    private int createBlock(HttpExchange exchange) throws IOException {
        CreateBlockRequest req;
        try {
            req = mapper.readValue(exchange.getRequestBody(), CreateBlockRequest.class);
        } catch (JsonProcessingException e) {
            return sendError(exchange, 400, "invalid_json", "Failed to parse block request");
        }
        if (req == null || req.data == null) {
            return sendError(exchange, 400, "missing_data", "Field 'data' is required");
        }

        CompletableFuture<Optional<MinedBlock>> job = node.mine(req.data);
        Optional<MinedBlock> mined;
        try {
            mined = job.get(miningTimeoutMillis, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            if (job.cancel(false)) {
                return sendError(exchange, 503, "mining_timeout", "Mining did not finish in time; the block was discarded");
            }
            // finished between the timeout and the cancel
            mined = job.join();
        } catch (InterruptedException e) {
            job.cancel(false);
            Thread.currentThread().interrupt();
            return sendError(exchange, 503, "interrupted", "Interrupted while mining; the block was discarded");
        } catch (ExecutionException e) {
            LOG.log(Level.WARNING, "Mining for API request failed", e.getCause());
            return sendError(exchange, 500, "mining_failed", Optional.ofNullable(e.getCause().getMessage()).orElse("Mining failed"));
        }
        if (mined.isEmpty()) {
            return sendError(exchange, 503, "mining_gave_up", "No nonce found within the configured tries");
        }
        MinedBlock result = mined.get();
        if (!result.accepted()) {
            return sendError(exchange, 409, "rejected", String.valueOf(result.result()));
        }
        ObjectNode resp = mapper.createObjectNode();
        resp.put("status", "ok");
        resp.set("block", mapper.valueToTree(result.block()));
        resp.put("announcedTo", result.announcedTo());
        return sendJson(exchange, 201, resp);
    }

    private int sync(HttpExchange exchange) throws IOException {
        byte[] body = exchange.getRequestBody().readAllBytes();
        String peer = null;
        if (body.length > 0) {
            try {
                SyncRequest req = mapper.readValue(body, SyncRequest.class);
                peer = req == null ? null : req.peer;
            } catch (JsonProcessingException e) {
                return sendError(exchange, 400, "invalid_json", "Failed to parse sync request");
            }
        }
        int sent = peer == null || peer.isBlank() ? node.requestChainFromAll() : node.requestChain(peer);
        ObjectNode resp = mapper.createObjectNode()
                .put("status", "requested")
                .put("publishedTo", sent);
        return sendJson(exchange, 202, resp);
    }

    @FunctionalInterface
    interface Responder {
        /** Writes the reply and returns its status code. */
        int respond(HttpExchange exchange) throws IOException;
    }

    /** Method check, auth, request timing and a 500 fallback around one endpoint. */
    final class Route implements HttpHandler {
        private final String allowedMethod;
        private final boolean authRequired;
        private final Responder responder;

        Route(String allowedMethod, boolean authRequired, Responder responder) {
            this.allowedMethod = allowedMethod;
            this.authRequired = authRequired;
            this.responder = responder;
        }

        @Override
        public void handle(HttpExchange exchange) throws IOException {
            String method = exchange.getRequestMethod();
            String path = exchange.getHttpContext().getPath();
            var sample = HttpMetrics.start();
            int status = 500;
            try {
                if (authRequired && !isAuthorized(exchange)) {
                    exchange.getResponseHeaders().set("WWW-Authenticate", "Bearer");
                    status = sendError(exchange, 401, "unauthorized", "Missing or invalid credentials");
                } else if (!allowedMethod.equalsIgnoreCase(method)) {
                    status = sendError(exchange, 405, "method_not_allowed", "Use " + allowedMethod + " for this endpoint");
                } else {
                    status = responder.respond(exchange);
                }
            } catch (RuntimeException e) {
                LOG.log(Level.WARNING, method + " " + path + " failed", e);
                status = sendError(exchange, 500, "internal_error", "Unexpected server error");
            } finally {
                HttpMetrics.stop(sample, method, path, status);
                exchange.close();
            }
        }
    }

    public static class CreateBlockRequest {
        public String data;
    }

    public static class SyncRequest {
        public String peer;
    }

    private boolean isAuthorized(HttpExchange exchange) {
        if (authToken == null) {
            return true;
        }
        List<String> authHeaders = exchange.getRequestHeaders().get("Authorization");
        if (authHeaders != null && authHeaders.contains("Bearer " + authToken)) {
            return true;
        }
        return authToken.equals(exchange.getRequestHeaders().getFirst("X-API-Key"));
    }

    private int sendJson(HttpExchange exchange, int status, Object body) throws IOException {
        byte[] payload = body instanceof byte[] bytes ? bytes : mapper.writeValueAsBytes(body);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, payload.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(payload);
        }
        return status;
    }

    private int sendError(HttpExchange exchange, int status, String code, String message) throws IOException {
        ObjectNode error = mapper.createObjectNode();
        error.put("error", code);
        error.put("message", message);
        return sendJson(exchange, status, error);
    }
}
