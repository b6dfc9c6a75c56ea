package io.threadkeep.core.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.threadkeep.core.capture.CapturePoller;
import io.threadkeep.core.capture.CaptureService;
import io.threadkeep.core.capture.RawCaptureReader;
import io.threadkeep.core.model.RawCapture;
import io.threadkeep.core.session.CapturedSession;
import io.threadkeep.core.session.SessionStore;
import io.threadkeep.core.summarize.SummaryService;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.HttpServerExchange;
import io.undertow.server.handlers.PathHandler;
import io.undertow.util.Headers;
import io.undertow.util.HttpString;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.ByteBuffer;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Local JSON API used by the spreadsheet add-in: session browsing, capture toggling, snapshot
 * ingestion and on-demand summaries.
 */
public final class GatewayServer implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(GatewayServer.class);
    private static final String CAPTURE_METHOD = "ui-automation";
    private static final String SESSIONS_PREFIX = "/sessions/";
    private static final String WORKBOOK_PREFIX = "workbook/";
    private static final String SUMMARY_SUFFIX = "/summary";
    private static final HttpString CORS_ALLOW_ORIGIN = new HttpString("Access-Control-Allow-Origin");
    private static final HttpString CORS_ALLOW_METHODS = new HttpString("Access-Control-Allow-Methods");
    private static final HttpString CORS_ALLOW_HEADERS = new HttpString("Access-Control-Allow-Headers");
    private static final HttpString CORS_ALLOW_CREDENTIALS = new HttpString("Access-Control-Allow-Credentials");

    private final ObjectMapper mapper;
    private final String host;
    private final int requestedPort;
    private final SessionStore store;
    private final CaptureService captureService;
    private final CapturePoller poller;
    private final SummaryService summaryService;
    private final double defaultRatio;
    private final AtomicBoolean running;
    private Undertow server;
    private int actualPort;

    public GatewayServer(
        String host,
        int port,
        SessionStore store,
        CaptureService captureService,
        CapturePoller poller,
        SummaryService summaryService,
        double defaultRatio
    ) {
        this.host = host == null || host.isBlank() ? "127.0.0.1" : host;
        this.requestedPort = port;
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.captureService = Objects.requireNonNull(captureService, "captureService must not be null");
        this.poller = poller;
        this.summaryService = Objects.requireNonNull(summaryService, "summaryService must not be null");
        this.defaultRatio = defaultRatio;
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.running = new AtomicBoolean(false);
    }

    public void start() {
        if (running.getAndSet(true)) {
            return;
        }

        PathHandler routes = Handlers.path()
            .addExactPath("/health", this::handleHealth)
            .addExactPath("/status", this::handleStatus)
            .addExactPath("/capturing", this::handleCapturing)
            .addExactPath("/snapshots", this::handleSnapshots)
            .addPrefixPath("/sessions", this::handleSessions);

        server = Undertow.builder()
            .addHttpListener(requestedPort, host)
            .setHandler(exchange -> handleWithCors(routes, exchange))
            .build();
        server.start();
        this.actualPort = resolveBoundPort(server, requestedPort);
        LOG.info("API server running on http://{}:{}", host, actualPort);
    }

    public int port() {
        return actualPort;
    }

    @Override
    public void close() {
        running.set(false);
        if (server != null) {
            server.stop();
            server = null;
            LOG.info("API server stopped");
        }
    }

    // The add-in runs on its own origin, so any origin is echoed back.
    private void handleWithCors(PathHandler routes, HttpServerExchange exchange) throws Exception {
        String origin = header(exchange, "Origin");
        if (!origin.isBlank()) {
            exchange.getResponseHeaders().put(CORS_ALLOW_ORIGIN, origin);
            exchange.getResponseHeaders().put(CORS_ALLOW_CREDENTIALS, "true");
            exchange.getResponseHeaders().put(CORS_ALLOW_METHODS, "GET,POST,DELETE,OPTIONS");
            exchange.getResponseHeaders().put(CORS_ALLOW_HEADERS, "Content-Type");
            exchange.getResponseHeaders().put(Headers.VARY, "Origin");
        }
        if ("OPTIONS".equalsIgnoreCase(exchange.getRequestMethod().toString())) {
            exchange.setStatusCode(204);
            exchange.endExchange();
            return;
        }
        routes.handleRequest(exchange);
    }

    private void handleHealth(HttpServerExchange exchange) throws IOException {
        if (!isMethod(exchange, "GET")) {
            sendJson(exchange, 405, Map.of("error", "method_not_allowed"));
            return;
        }
        sendJson(exchange, 200, Map.of("status", "ok"));
    }

    private void handleStatus(HttpServerExchange exchange) throws Exception {
        if (exchange.isInIoThread()) {
            exchange.dispatch(() -> {
                try {
                    handleStatus(exchange);
                } catch (Exception e) {
                    sendInternalError(exchange, e);
                }
            });
            return;
        }
        if (!isMethod(exchange, "GET")) {
            sendJson(exchange, 405, Map.of("error", "method_not_allowed"));
            return;
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("running", poller != null && poller.isRunning());
        payload.put("capturing", captureService.context().isEnabled());
        payload.put("sessionCount", store.count());
        payload.put("captureMethod", CAPTURE_METHOD);
        payload.put("apiPort", actualPort);
        sendJson(exchange, 200, payload);
    }

    private void handleCapturing(HttpServerExchange exchange) throws Exception {
        if (exchange.isInIoThread()) {
            exchange.dispatch(() -> {
                try {
                    handleCapturing(exchange);
                } catch (Exception e) {
                    sendInternalError(exchange, e);
                }
            });
            return;
        }
        if (!isMethod(exchange, "POST")) {
            sendJson(exchange, 405, Map.of("error", "method_not_allowed"));
            return;
        }
        JsonNode enabled;
        try {
            enabled = readJsonBody(exchange).get("enabled");
        } catch (IllegalArgumentException e) {
            sendJson(exchange, 400, Map.of("error", e.getMessage()));
            return;
        }
        if (enabled == null || !enabled.isBoolean()) {
            sendJson(exchange, 400, Map.of("error", "enabled must be a boolean"));
            return;
        }
        if (enabled.booleanValue()) {
            captureService.context().enable();
        } else {
            captureService.context().disable();
        }
        LOG.info("Capturing {}", enabled.booleanValue() ? "enabled" : "disabled");
        sendJson(exchange, 200, Map.of("capturing", captureService.context().isEnabled()));
    }

    private void handleSnapshots(HttpServerExchange exchange) throws Exception {
        if (exchange.isInIoThread()) {
            exchange.dispatch(() -> {
                try {
                    handleSnapshots(exchange);
                } catch (Exception e) {
                    sendInternalError(exchange, e);
                }
            });
            return;
        }
        if (!isMethod(exchange, "POST")) {
            sendJson(exchange, 405, Map.of("error", "method_not_allowed"));
            return;
        }
        RawCapture capture;
        try {
            capture = RawCaptureReader.fromJson(readJsonBody(exchange));
        } catch (IllegalArgumentException e) {
            sendJson(exchange, 400, Map.of("error", e.getMessage()));
            return;
        }

        CaptureService.CaptureResult result = captureService.ingest(capture);
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("updated", result.updated());
        if (result.updated()) {
            payload.put("sessionId", result.session().id());
            payload.put("messageCount", result.session().messages().size());
        } else {
            payload.put("reason", result.reason().name().toLowerCase(Locale.ROOT));
        }
        sendJson(exchange, 200, payload);
    }

    private void handleSessions(HttpServerExchange exchange) throws Exception {
        if (exchange.isInIoThread()) {
            exchange.dispatch(() -> {
                try {
                    handleSessions(exchange);
                } catch (Exception e) {
                    sendInternalError(exchange, e);
                }
            });
            return;
        }

        String path = exchange.getRequestPath();
        if ("/sessions".equals(path) || "/sessions/".equals(path)) {
            handleSessionCollection(exchange);
            return;
        }
        if (!path.startsWith(SESSIONS_PREFIX)) {
            sendJson(exchange, 404, Map.of("error", "not_found"));
            return;
        }

        String rest = path.substring(SESSIONS_PREFIX.length());
        if (rest.startsWith(WORKBOOK_PREFIX) && rest.length() > WORKBOOK_PREFIX.length()) {
            if (!isMethod(exchange, "GET")) {
                sendJson(exchange, 405, Map.of("error", "method_not_allowed"));
                return;
            }
            sendJson(exchange, 200, store.listByWorkbook(rest.substring(WORKBOOK_PREFIX.length())));
            return;
        }
        if (rest.endsWith(SUMMARY_SUFFIX) && rest.length() > SUMMARY_SUFFIX.length()) {
            handleSessionSummary(exchange, rest.substring(0, rest.length() - SUMMARY_SUFFIX.length()));
            return;
        }
        if (rest.isBlank() || rest.contains("/")) {
            sendJson(exchange, 404, Map.of("error", "not_found"));
            return;
        }
        handleSingleSession(exchange, rest);
    }

    private void handleSessionCollection(HttpServerExchange exchange) throws IOException {
        if (isMethod(exchange, "GET")) {
            String search = queryParam(exchange, "search");
            sendJson(exchange, 200, search.isBlank() ? store.list() : store.search(search));
            return;
        }
        if (isMethod(exchange, "DELETE")) {
            store.clear();
            LOG.info("All sessions cleared");
            sendJson(exchange, 200, Map.of("success", true));
            return;
        }
        sendJson(exchange, 405, Map.of("error", "method_not_allowed"));
    }

    private void handleSingleSession(HttpServerExchange exchange, String id) throws IOException {
        if (isMethod(exchange, "GET")) {
            Optional<CapturedSession> session = store.findById(id);
            if (session.isEmpty()) {
                sendJson(exchange, 404, Map.of("error", "Session not found"));
                return;
            }
            sendJson(exchange, 200, session.get());
            return;
        }
        if (isMethod(exchange, "DELETE")) {
            if (store.delete(id)) {
                LOG.info("Session {} deleted", id);
                sendJson(exchange, 200, Map.of("success", true));
            } else {
                sendJson(exchange, 404, Map.of("error", "Session not found"));
            }
            return;
        }
        sendJson(exchange, 405, Map.of("error", "method_not_allowed"));
    }

    private void handleSessionSummary(HttpServerExchange exchange, String id) throws IOException {
        if (!isMethod(exchange, "GET")) {
            sendJson(exchange, 405, Map.of("error", "method_not_allowed"));
            return;
        }
        double ratio = parseQueryDouble(exchange, "ratio", defaultRatio);
        SummaryService.Strategy strategy = SummaryService.Strategy.parse(queryParam(exchange, "strategy"));
        Optional<SummaryService.Summary> summary = summaryService.summarizeSession(id, ratio, strategy);
        if (summary.isEmpty()) {
            sendJson(exchange, 404, Map.of("error", "Session not found"));
            return;
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("sessionId", summary.get().sessionId());
        payload.put("strategy", summary.get().strategy());
        payload.put("ratio", summary.get().ratio());
        payload.put("messages", summary.get().messages());
        sendJson(exchange, 200, payload);
    }

    private void sendJson(HttpServerExchange exchange, int status, Object payload) throws IOException {
        byte[] body = mapper.writeValueAsBytes(payload);
        exchange.setStatusCode(status);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json; charset=utf-8");
        exchange.getResponseHeaders().put(Headers.CONTENT_LENGTH, String.valueOf(body.length));
        exchange.getResponseSender().send(ByteBuffer.wrap(body));
    }

    private JsonNode readJsonBody(HttpServerExchange exchange) throws IOException {
        exchange.startBlocking();
        byte[] bytes = exchange.getInputStream().readAllBytes();
        if (bytes.length == 0) {
            return mapper.createObjectNode();
        }
        try {
            return mapper.readTree(bytes);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("request body is not valid JSON", e);
        }
    }

    private double parseQueryDouble(HttpServerExchange exchange, String key, double fallback) {
        String raw = queryParam(exchange, key);
        if (raw.isBlank()) {
            return fallback;
        }
        try {
            return Double.parseDouble(raw);
        } catch (NumberFormatException ignored) {
            return fallback;
        }
    }

    private String queryParam(HttpServerExchange exchange, String key) {
        Deque<String> values = exchange.getQueryParameters().get(key);
        if (values == null || values.isEmpty()) {
            return "";
        }
        String value = values.peekFirst();
        return value == null ? "" : value;
    }

    private boolean isMethod(HttpServerExchange exchange, String method) {
        return method.equalsIgnoreCase(exchange.getRequestMethod().toString());
    }

    private void sendInternalError(HttpServerExchange exchange, Exception error) {
        LOG.warn("Request {} {} failed", exchange.getRequestMethod(), exchange.getRequestPath(), error);
        try {
            sendJson(exchange, 500, Map.of("error", error.getMessage() == null ? "internal_error" : error.getMessage()));
        } catch (IOException e) {
            LOG.debug("Could not send error response", e);
        }
    }

    private String header(HttpServerExchange exchange, String name) {
        String value = exchange.getRequestHeaders().getFirst(name);
        return value == null ? "" : value;
    }

    private static int resolveBoundPort(Undertow undertow, int fallbackPort) {
        List<Undertow.ListenerInfo> listeners = undertow.getListenerInfo();
        if (!listeners.isEmpty() && listeners.get(0).getAddress() instanceof InetSocketAddress socketAddress) {
            return socketAddress.getPort();
        }
        return fallbackPort;
    }
}
