package io.governance.core.rpc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import io.governance.core.gov.GovernanceConfig;
import io.governance.core.gov.GovernanceException;
import io.governance.core.metrics.GovernanceMetrics;
import io.governance.core.node.GovernanceNode;
import io.governance.core.poll.OrderBy;
import io.governance.core.poll.Poll;
import io.governance.core.poll.PollStatus;
import io.governance.core.poll.VoteOption;
import io.governance.core.poll.VoterEntry;
import io.governance.core.protocol.HandleResponse;
import io.governance.core.protocol.UpdateConfigRequest;

import java.io.IOException;
import java.io.OutputStream;
import java.math.BigDecimal;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * HTTP JSON surface of a governance node. Queries are GETs; every state-changing call is a POST
 * whose body names the {@code sender} and runs at the node's current height.
 */
public final class RpcServer {
    private static final Logger LOG = Logger.getLogger(RpcServer.class.getName());

    private final GovernanceNode node;
    private final String bindAddress;
    private final int port;
    private final String authToken;
    private final ObjectMapper mapper;
    private HttpServer server;
    private ExecutorService executor;

    public RpcServer(GovernanceNode node, String bindAddress, int port, String authToken) {
        this.node = node;
        this.bindAddress = (bindAddress == null || bindAddress.isBlank()) ? "127.0.0.1" : bindAddress;
        this.port = port;
        this.authToken = (authToken == null || authToken.isBlank()) ? null : authToken;
        this.mapper = new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public void start() throws IOException {
        if (server != null) {
            throw new IllegalStateException("RPC server already running");
        }
        server = HttpServer.create(new InetSocketAddress(bindAddress, port), 0);
        server.createContext("/status", new StatusHandler());
        server.createContext("/config", new ConfigHandler());
        server.createContext("/state", new StateHandler());
        server.createContext("/poll", new PollHandler());
        server.createContext("/polls", new PollsHandler());
        server.createContext("/staker", new StakerHandler());
        server.createContext("/voters", new VotersHandler());
        server.createContext("/metrics", new MetricsHandler());
        server.createContext("/token/send", new SendHandler());
        server.createContext("/vote", new VoteHandler());
        server.createContext("/snapshot", new PollActionHandler(PollAction.SNAPSHOT));
        server.createContext("/end", new PollActionHandler(PollAction.END));
        server.createContext("/execute", new PollActionHandler(PollAction.EXECUTE));
        server.createContext("/expire", new PollActionHandler(PollAction.EXPIRE));
        server.createContext("/withdraw", new WithdrawHandler());
        server.createContext("/update-config", new UpdateConfigHandler());
        executor = Executors.newCachedThreadPool();
        server.setExecutor(executor);
        server.start();
        LOG.info(() -> "RPC server listening on http://" + bindAddress + ':' + port() + (authToken != null ? " (auth required)" : ""));
    }

    public void stop() {
        if (server != null) {
            server.stop(0);
            server = null;
        }
        if (executor != null) {
            executor.shutdownNow();
            executor = null;
        }
    }

    /** Bound port; differs from the configured one when that was 0. */
    public int port() {
        return server != null ? server.getAddress().getPort() : port;
    }

    private boolean authorized(HttpExchange exchange) {
        if (authToken == null) {
            return true;
        }
        List<String> authHeaders = exchange.getRequestHeaders().get("Authorization");
        if (authHeaders != null) {
            for (String header : authHeaders) {
                if (header != null && header.equals("Bearer " + authToken)) {
                    return true;
                }
            }
        }
        String apiKey = exchange.getRequestHeaders().getFirst("X-API-Key");
        return apiKey != null && apiKey.equals(authToken);
    }

    /** Maps a governance failure to an HTTP status by its category. */
    static int statusFor(GovernanceException e) {
        switch (e.category()) {
            case VALIDATION: return 400;
            case AUTHORIZATION: return 403;
            case NOT_FOUND: return 404;
            case STATE: return 409;
            case RESOURCE: return 422;
            default: return 500;
        }
    }

    /**
     * Shared request plumbing: method check, auth, timing, and the mapping of failures to
     * JSON error bodies.
     */
    private abstract class Endpoint implements HttpHandler {
        private final String allowedMethod;

        Endpoint(String allowedMethod) {
            this.allowedMethod = allowedMethod;
        }

        abstract int serve(HttpExchange exchange) throws IOException;

        @Override
        public final void handle(HttpExchange exchange) throws IOException {
            String method = exchange.getRequestMethod();
            String path = exchange.getHttpContext().getPath();
            var sample = GovernanceMetrics.startRequest();
            int status = 500;
            try {
                if (!path.equals(exchange.getRequestURI().getPath())) {
                    status = sendError(exchange, 404, "not_found", "No such endpoint");
                    return;
                }
                if (!allowedMethod.equalsIgnoreCase(method)) {
                    status = sendError(exchange, 405, "method_not_allowed", "Use " + allowedMethod + " for this endpoint");
                    return;
                }
                if (!authorized(exchange)) {
                    exchange.getResponseHeaders().set("WWW-Authenticate", "Bearer");
                    status = sendError(exchange, 401, "unauthorized", "Missing or invalid credentials");
                    return;
                }
                status = serve(exchange);
            } catch (GovernanceException e) {
                status = sendError(exchange, statusFor(e), e.error().name().toLowerCase(), e.getMessage());
            } catch (BadRequest e) {
                status = sendError(exchange, 400, e.code, e.getMessage());
            } catch (IllegalArgumentException e) {
                status = sendError(exchange, 400, "invalid_request", Optional.ofNullable(e.getMessage()).orElse("Invalid request"));
            } catch (IllegalStateException e) {
                status = sendError(exchange, 422, "rejected", Optional.ofNullable(e.getMessage()).orElse("Rejected"));
            } catch (Exception e) {
                LOG.log(Level.WARNING, path + " handler failed", e);
                status = sendError(exchange, 500, "internal_error", "Unexpected server error");
            } finally {
                GovernanceMetrics.stopRequest(sample, method, path, status);
                exchange.close();
            }
        }
    }

    private static final class BadRequest extends RuntimeException {
        final String code;

        BadRequest(String code, String message) {
            super(message);
            this.code = code;
        }
    }

    // -------------------- queries --------------------

    final class StatusHandler extends Endpoint {
        StatusHandler() { super("GET"); }

        @Override
        int serve(HttpExchange exchange) throws IOException {
            ObjectNode resp = mapper.createObjectNode();
            resp.put("height", node.height());
            resp.put("contract", node.config().contractAddress);
            resp.put("token", node.config().tokenAddress);
            resp.put("contractBalance", node.token().balanceOf(node.config().contractAddress));
            return sendJson(exchange, 200, resp);
        }
    }

    final class ConfigHandler extends Endpoint {
        ConfigHandler() { super("GET"); }

        @Override
        int serve(HttpExchange exchange) throws IOException {
            GovernanceConfig config = node.queries().config();
            return sendJson(exchange, 200, config);
        }
    }

    final class StateHandler extends Endpoint {
        StateHandler() { super("GET"); }

        @Override
        int serve(HttpExchange exchange) throws IOException {
            return sendJson(exchange, 200, node.queries().state());
        }
    }

    final class PollHandler extends Endpoint {
        PollHandler() { super("GET"); }

        @Override
        int serve(HttpExchange exchange) throws IOException {
            long id = requireLong(exchange.getRequestURI(), "id");
            return sendJson(exchange, 200, node.queries().poll(id));
        }
    }

    final class PollsHandler extends Endpoint {
        PollsHandler() { super("GET"); }

        @Override
        int serve(HttpExchange exchange) throws IOException {
            URI uri = exchange.getRequestURI();
            String filter = queryParam(uri, "filter");
            PollStatus status = filter == null || filter.isBlank() ? null : PollStatus.fromWire(filter);
            List<Poll> polls = node.queries().polls(status, optionalLong(uri, "start_after"),
                    optionalInt(uri, "limit"), OrderBy.fromWire(queryParam(uri, "order_by")));
            ObjectNode resp = mapper.createObjectNode();
            resp.set("polls", mapper.valueToTree(polls));
            return sendJson(exchange, 200, resp);
        }
    }

    final class StakerHandler extends Endpoint {
        StakerHandler() { super("GET"); }

        @Override
        int serve(HttpExchange exchange) throws IOException {
            String address = queryParam(exchange.getRequestURI(), "address");
            if (address == null || address.isBlank()) {
                throw new BadRequest("missing_address", "Query parameter 'address' is required");
            }
            return sendJson(exchange, 200, node.queries().staker(address));
        }
    }

    final class VotersHandler extends Endpoint {
        VotersHandler() { super("GET"); }

        @Override
        int serve(HttpExchange exchange) throws IOException {
            URI uri = exchange.getRequestURI();
            long pollId = requireLong(uri, "poll_id");
            List<VoterEntry> voters = node.queries().voters(pollId, queryParam(uri, "start_after"),
                    optionalInt(uri, "limit"), OrderBy.fromWire(queryParam(uri, "order_by")));
            ArrayNode array = mapper.createArrayNode();
            for (VoterEntry entry : voters) {
                array.addObject()
                        .put("voter", entry.voter())
                        .put("vote", entry.info().vote().toString())
                        .put("balance", entry.info().balance());
            }
            ObjectNode resp = mapper.createObjectNode().set("voters", array);
            return sendJson(exchange, 200, resp);
        }
    }

    final class MetricsHandler extends Endpoint {
        MetricsHandler() { super("GET"); }

        @Override
        int serve(HttpExchange exchange) throws IOException {
            byte[] payload = GovernanceMetrics.scrapeMetrics().getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().set("Content-Type", "text/plain; version=0.0.4");
            exchange.sendResponseHeaders(200, payload.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(payload);
            }
            return 200;
        }
    }

    // -------------------- invocations --------------------

    final class SendHandler extends Endpoint {
        SendHandler() { super("POST"); }

        @Override
        int serve(HttpExchange exchange) throws IOException {
            SendRequest req = readBody(exchange, SendRequest.class);
            if (req.from == null || req.from.isBlank() || req.msg == null || req.msg.isNull()) {
                throw new BadRequest("missing_fields", "Fields 'from' and 'msg' are required");
            }
            if (req.amount <= 0) {
                throw new BadRequest("invalid_amount", "Amount must be > 0");
            }
            byte[] msg = mapper.writeValueAsBytes(req.msg);
            return sendResult(exchange, node.send(req.from, req.amount, msg));
        }
    }

    final class VoteHandler extends Endpoint {
        VoteHandler() { super("POST"); }

        @Override
        int serve(HttpExchange exchange) throws IOException {
            VoteRequest req = readBody(exchange, VoteRequest.class);
            requireSender(req.sender);
            if (req.pollId == null || req.vote == null || req.amount == null) {
                throw new BadRequest("missing_fields", "Fields 'pollId', 'vote' and 'amount' are required");
            }
            VoteOption vote = VoteOption.fromWire(req.vote);
            return sendResult(exchange, node.castVote(req.sender, req.pollId, vote, req.amount));
        }
    }

    enum PollAction { SNAPSHOT, END, EXECUTE, EXPIRE }

    final class PollActionHandler extends Endpoint {
        private final PollAction action;

        PollActionHandler(PollAction action) {
            super("POST");
            this.action = action;
        }

        @Override
        int serve(HttpExchange exchange) throws IOException {
            PollRequest req = readBody(exchange, PollRequest.class);
            requireSender(req.sender);
            if (req.pollId == null) {
                throw new BadRequest("missing_fields", "Field 'pollId' is required");
            }
            HandleResponse res;
            switch (action) {
                case SNAPSHOT: res = node.snapshotPoll(req.sender, req.pollId); break;
                case END: res = node.endPoll(req.sender, req.pollId); break;
                case EXECUTE: res = node.executePoll(req.sender, req.pollId); break;
                case EXPIRE: res = node.expirePoll(req.sender, req.pollId); break;
                default: throw new IllegalStateException("Unhandled action " + action);
            }
            return sendResult(exchange, res);
        }
    }

    final class WithdrawHandler extends Endpoint {
        WithdrawHandler() { super("POST"); }

        @Override
        int serve(HttpExchange exchange) throws IOException {
            WithdrawRequest req = readBody(exchange, WithdrawRequest.class);
            requireSender(req.sender);
            OptionalLong amount = req.amount == null ? OptionalLong.empty() : OptionalLong.of(req.amount);
            return sendResult(exchange, node.withdraw(req.sender, amount));
        }
    }

    final class UpdateConfigHandler extends Endpoint {
        UpdateConfigHandler() { super("POST"); }

        @Override
        int serve(HttpExchange exchange) throws IOException {
            UpdateConfigBody req = readBody(exchange, UpdateConfigBody.class);
            requireSender(req.sender);
            UpdateConfigRequest update = new UpdateConfigRequest(req.owner, req.quorum, req.threshold,
                    req.votingPeriod, req.timelockPeriod, req.expirationPeriod, req.proposalDeposit, req.snapshotPeriod);
            return sendResult(exchange, node.updateConfig(req.sender, update));
        }
    }

    // -------------------- helpers --------------------

    private <T> T readBody(HttpExchange exchange, Class<T> type) throws IOException {
        T req;
        try {
            req = mapper.readValue(exchange.getRequestBody(), type);
        } catch (JsonProcessingException e) {
            throw new BadRequest("invalid_json", "Failed to parse request body");
        }
        if (req == null) {
            throw new BadRequest("invalid_json", "Request body is required");
        }
        return req;
    }

    private static void requireSender(String sender) {
        if (sender == null || sender.isBlank()) {
            throw new BadRequest("missing_sender", "Field 'sender' is required");
        }
    }

    private int sendResult(HttpExchange exchange, HandleResponse res) throws IOException {
        ObjectNode resp = mapper.createObjectNode();
        ObjectNode attrs = resp.putObject("attributes");
        for (HandleResponse.Attribute a : res.attributes()) {
            attrs.put(a.key(), a.value());
        }
        resp.put("messages", res.messages().size());
        resp.put("height", node.height());
        return sendJson(exchange, 200, resp);
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

    private long requireLong(URI uri, String name) {
        Long value = optionalLong(uri, name);
        if (value == null) {
            throw new BadRequest("missing_" + name, "Query parameter '" + name + "' is required");
        }
        return value;
    }

    private Long optionalLong(URI uri, String name) {
        String raw = queryParam(uri, name);
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return Long.parseLong(raw);
        } catch (NumberFormatException e) {
            throw new BadRequest("invalid_" + name, "Query parameter '" + name + "' must be an integer");
        }
    }

    private Integer optionalInt(URI uri, String name) {
        Long value = optionalLong(uri, name);
        return value == null ? null : (int) Math.max(Integer.MIN_VALUE, Math.min(Integer.MAX_VALUE, value));
    }

    private String queryParam(URI uri, String name) {
        String query = uri.getRawQuery();
        if (query == null) {
            return null;
        }
        for (String pair : query.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            String[] kv = pair.split("=", 2);
            if (kv.length != 2) {
                continue;
            }
            String key = URLDecoder.decode(kv[0], StandardCharsets.UTF_8);
            if (name.equals(key)) {
                return URLDecoder.decode(kv[1], StandardCharsets.UTF_8);
            }
        }
        return null;
    }

    private static class SendRequest {
        public String from;
        public long amount;
        public JsonNode msg;
    }

    private static class VoteRequest {
        public String sender;
        public Long pollId;
        public String vote;
        public Long amount;
    }

    private static class PollRequest {
        public String sender;
        public Long pollId;
    }

    private static class WithdrawRequest {
        public String sender;
        public Long amount;
    }

    private static class UpdateConfigBody {
        public String sender;
        public String owner;
        public BigDecimal quorum;
        public BigDecimal threshold;
        public Long votingPeriod;
        public Long timelockPeriod;
        public Long expirationPeriod;
        public Long proposalDeposit;
        public Long snapshotPeriod;
    }
}
