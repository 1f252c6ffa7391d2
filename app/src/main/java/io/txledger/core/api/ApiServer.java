package io.txledger.core.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import io.micrometer.core.instrument.Timer;
import io.txledger.core.ledger.TransactionStatus;
import io.txledger.core.metrics.HttpMetrics;
import io.txledger.core.metrics.LedgerMetrics;
import io.txledger.core.node.TransactionLedger;
import io.txledger.core.protocol.AccountAddress;
import io.txledger.core.protocol.Bytes;
import io.txledger.core.protocol.DecodeException;
import io.txledger.core.protocol.Hash;
import io.txledger.core.protocol.Transaction;
import io.txledger.core.protocol.TransactionCodec;
import io.txledger.core.updates.Updates;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Read-mostly HTTP view of the ledger plus transaction submission.
 * When a token is configured every request needs {@code Authorization: Bearer <token>}
 * or {@code X-API-Key: <token>}.
 */
public class ApiServer {
    private static final Logger LOG = Logger.getLogger(ApiServer.class.getName());

    /** Slot recorded for transactions submitted over HTTP, outside of any block. */
    private static final long SUBMISSION_SLOT = 0L;

    private final TransactionLedger ledger;
    private final String bindAddress;
    private final int port;
    private final String authToken;
    private final Clock clock;
    private final ObjectMapper mapper;
    private HttpServer httpServer;

    public ApiServer(TransactionLedger ledger, String bindAddress, int port, String authToken, Clock clock) {
        this.ledger = ledger;
        this.bindAddress = bindAddress == null || bindAddress.isBlank() ? "127.0.0.1" : bindAddress;
        this.port = port;
        this.authToken = authToken == null || authToken.isBlank() ? null : authToken;
        this.clock = clock;
        this.mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public ApiServer(TransactionLedger ledger, String bindAddress, int port, String authToken) {
        this(ledger, bindAddress, port, authToken, Clock.systemUTC());
    }

    public void start() throws IOException {
        httpServer = HttpServer.create(new InetSocketAddress(bindAddress, port), 0);
        httpServer.createContext("/transactions/status", new StatusHandler());
        httpServer.createContext("/transactions", new SubmitHandler());
        httpServer.createContext("/accounts/nonce", new NonceHandler());
        httpServer.createContext("/updates", new UpdatesHandler());
        httpServer.createContext("/metrics", new MetricsHandler());
        httpServer.setExecutor(null);
        httpServer.start();
        LOG.info(() -> "API listening on http://" + bindAddress + ':' + boundPort() + (authToken != null ? " (auth required)" : ""));
    }

    public void stop() {
        if (httpServer != null) {
            httpServer.stop(0);
            httpServer = null;
        }
    }

    /** Actual port, useful when started on port 0. */
    public int boundPort() {
        return httpServer == null ? port : httpServer.getAddress().getPort();
    }

    private abstract class Endpoint implements HttpHandler {
        private final String allowedMethod;

        Endpoint(String allowedMethod) {
            this.allowedMethod = allowedMethod;
        }

        abstract int serve(HttpExchange exchange) throws IOException;

        @Override
        public void handle(HttpExchange exchange) throws IOException {
            String method = exchange.getRequestMethod();
            String path = exchange.getHttpContext().getPath();
            Timer.Sample sample = HttpMetrics.start();
            int status = 500;
            try {
                if (!allowedMethod.equalsIgnoreCase(method)) {
                    status = sendError(exchange, 405, "method_not_allowed", "Use " + allowedMethod + " for this endpoint");
                    return;
                }
                status = ensureAuthorized(exchange);
                if (status != -1) {
                    return;
                }
                status = serve(exchange);
            } catch (Exception e) {
                LOG.log(Level.WARNING, method + " " + path + " failed", e);
                status = sendError(exchange, 500, "internal_error", "Unexpected server error");
            } finally {
                HttpMetrics.stop(sample, method, path, status);
                exchange.close();
            }
        }
    }

    final class StatusHandler extends Endpoint {
        StatusHandler() { super("GET"); }

        @Override
        int serve(HttpExchange exchange) throws IOException {
            String hex = queryParam(exchange, "hash");
            if (hex == null || hex.isBlank()) {
                return sendError(exchange, 400, "missing_hash", "Query parameter 'hash' is required");
            }
            Hash hash;
            try {
                hash = Hash.fromHex(hex);
            } catch (IllegalArgumentException e) {
                return sendError(exchange, 400, "invalid_hash", "Parameter 'hash' must be 32 hex-encoded bytes");
            }
            Optional<TransactionStatus> status = ledger.status(hash);
            if (status.isEmpty()) {
                return sendError(exchange, 404, "unknown_transaction", "No transaction " + hash.hex());
            }
            return sendJson(exchange, 200, statusJson(hash, status.get()));
        }
    }

    final class SubmitHandler extends Endpoint {
        SubmitHandler() { super("POST"); }

        @Override
        int serve(HttpExchange exchange) throws IOException {
            SubmitRequest req;
            try {
                req = mapper.readValue(exchange.getRequestBody(), SubmitRequest.class);
            } catch (JsonProcessingException e) {
                return sendError(exchange, 400, "invalid_json", "Failed to parse submission");
            }
            if (req == null || req.transaction == null || req.transaction.isBlank()) {
                return sendError(exchange, 400, "missing_transaction", "Field 'transaction' is required");
            }
            Transaction tx;
            try {
                tx = TransactionCodec.fromBytes(Bytes.fromHex(req.transaction), clock.millis() / 1000,
                        ledger.config().maxPayloadBytes);
            } catch (DecodeException e) {
                LedgerMetrics.incrementRejected("malformed");
                return sendError(exchange, 400, "malformed", Optional.ofNullable(e.getMessage()).orElse("Malformed transaction"));
            }
            TransactionLedger.ReceiveResult result = ledger.receive(tx, SUBMISSION_SLOT);
            ObjectNode resp = mapper.createObjectNode()
                    .put("hash", tx.hash().hex())
                    .put("result", result.name().toLowerCase());
            switch (result) {
                case ACCEPTED:
                    return sendJson(exchange, 202, resp);
                case DUPLICATE:
                    return sendJson(exchange, 200, resp);
                default:
                    return sendJson(exchange, 400, resp);
            }
        }
    }

    final class NonceHandler extends Endpoint {
        NonceHandler() { super("GET"); }

        @Override
        int serve(HttpExchange exchange) throws IOException {
            String hex = queryParam(exchange, "address");
            if (hex == null || hex.isBlank()) {
                return sendError(exchange, 400, "missing_address", "Query parameter 'address' is required");
            }
            AccountAddress address;
            try {
                address = AccountAddress.fromHex(hex);
            } catch (IllegalArgumentException e) {
                return sendError(exchange, 400, "invalid_address", "Parameter 'address' must be 32 hex-encoded bytes");
            }
            int pending = ledger.nonFinalized(address).values().stream().mapToInt(s -> s.size()).sum();
            ObjectNode resp = mapper.createObjectNode()
                    .put("address", address.hex())
                    .put("nextNonce", ledger.nextNonce(address))
                    .put("nonFinalized", pending);
            return sendJson(exchange, 200, resp);
        }
    }

    final class UpdatesHandler extends Endpoint {
        UpdatesHandler() { super("GET"); }

        @Override
        int serve(HttpExchange exchange) throws IOException {
            Optional<Updates> updates = ledger.lastFinalizedUpdates();
            if (updates.isEmpty()) {
                return sendError(exchange, 404, "no_state", "No finalized governance state yet");
            }
            return sendJson(exchange, 200, updates.get());
        }
    }

    final class MetricsHandler extends Endpoint {
        MetricsHandler() { super("GET"); }

        @Override
        int serve(HttpExchange exchange) throws IOException {
            byte[] body = LedgerMetrics.scrapeMetrics().getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().set("Content-Type", "text/plain; charset=utf-8");
            exchange.sendResponseHeaders(200, body.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(body);
            }
            return 200;
        }
    }

    public static class SubmitRequest {
        public String transaction;
    }

    private ObjectNode statusJson(Hash hash, TransactionStatus status) {
        ObjectNode node = mapper.createObjectNode();
        node.put("hash", hash.hex());
        node.put("status", status.kind().name().toLowerCase());
        node.put("slot", status.slot());
        if (status instanceof TransactionStatus.Committed committed) {
            ObjectNode blocks = node.putObject("blocks");
            for (Map.Entry<Hash, Long> e : committed.outcomes().entrySet()) {
                blocks.put(e.getKey().hex(), e.getValue());
            }
        } else if (status instanceof TransactionStatus.Finalized finalized) {
            node.put("blockHash", finalized.blockHash().hex());
            node.put("index", finalized.index());
        }
        return node;
    }

    private int ensureAuthorized(HttpExchange exchange) throws IOException {
        if (authToken == null) {
            return -1;
        }
        List<String> authHeaders = exchange.getRequestHeaders().get("Authorization");
        if (authHeaders != null) {
            for (String header : authHeaders) {
                if (header != null && header.equals("Bearer " + authToken)) {
                    return -1;
                }
            }
        }
        String apiKey = exchange.getRequestHeaders().getFirst("X-API-Key");
        if (apiKey != null && apiKey.equals(authToken)) {
            return -1;
        }
        exchange.getResponseHeaders().set("WWW-Authenticate", "Bearer");
        return sendError(exchange, 401, "unauthorized", "Missing or invalid credentials");
    }

    private int sendJson(HttpExchange exchange, int status, Object body) throws IOException {
        byte[] payload = mapper.writeValueAsBytes(body);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, payload.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(payload);
        }
        return status;
    }

    private int sendError(HttpExchange exchange, int status, String code, String message) throws IOException {
        ObjectNode node = mapper.createObjectNode();
        node.put("error", code);
        node.put("message", message);
        return sendJson(exchange, status, node);
    }

    private static String queryParam(HttpExchange exchange, String key) {
        String query = exchange.getRequestURI().getRawQuery();
        if (query == null || query.isBlank()) {
            return null;
        }
        for (String part : query.split("&")) {
            String[] kv = part.split("=", 2);
            if (kv.length != 2) {
                continue;
            }
            if (key.equals(URLDecoder.decode(kv[0], StandardCharsets.UTF_8))) {
                return URLDecoder.decode(kv[1], StandardCharsets.UTF_8);
            }
        }
        return null;
    }
}
