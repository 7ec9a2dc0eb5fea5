package screennav.server;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import screennav.model.CatalogIO;
import screennav.model.NavigationResult;
import screennav.model.PopupPattern;
import screennav.model.ScreenSignature;
import screennav.navigator.CancellationToken;
import screennav.navigator.DeviceBusyException;
import screennav.navigator.NavigationException;
import screennav.service.DeviceNotFoundException;
import screennav.service.ScreenNavigationService;
import screennav.service.ScreenNotFoundException;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Embedded HTTP API over {@link ScreenNavigationService}.
 *
 * <p>Listens on localhost:{port} (default 8765). Uses JDK's built-in
 * {@code com.sun.net.httpserver.HttpServer}. All responses are JSON and carry
 * CORS headers so browser-based tools can call the API directly.
 *
 * <pre>
 * GET  /api/devices
 * GET  /api/devices/{serial}/screen?app=&amp;refresh=
 * POST /api/devices/{serial}/navigate        {"app","target","maxAttempts","verifyEachStep"}
 * POST /api/devices/{serial}/recover         {"app","context"}
 * GET  /api/devices/{serial}/stats
 * GET  /api/devices/{serial}/signature-dump
 * POST /api/devices/{serial}/popups/check    {"patterns":[{"name","detect","dismiss"}]}
 * GET  /api/apps/{app}/graph?from=
 * GET  /api/apps/{app}/screens?screen=
 * POST /api/apps/{app}/signatures            [ScreenSignature...]
 * </pre>
 */
@SuppressWarnings("restriction")
public class APIServer {

    private static final Logger log = LoggerFactory.getLogger(APIServer.class);

    private static final String DEVICES_PREFIX = "/api/devices";
    private static final String APPS_PREFIX    = "/api/apps/";

    // ── Core fields ──────────────────────────────────────────────────────────

    private final int port;
    private final ScreenNavigationService service;
    private final ObjectMapper mapper = CatalogIO.getMapper();
    private HttpServer httpServer;
    private ExecutorService executor;

    // ── Constructor ──────────────────────────────────────────────────────────

    /**
     * @param port    TCP port on localhost; 0 picks a free port (see {@link #getPort()})
     * @param service the service every endpoint delegates to
     */
    public APIServer(int port, ScreenNavigationService service) {
        this.port    = port;
        this.service = service;
    }

    // ── Lifecycle ────────────────────────────────────────────────────────────

    public void start() {
        try {
            httpServer = HttpServer.create(new InetSocketAddress("localhost", port), 0);
            // One worker per in-flight request; navigation blocks for seconds
            executor = Executors.newFixedThreadPool(8);
            httpServer.setExecutor(executor);

            httpServer.createContext(DEVICES_PREFIX, this::handleDevices);
            httpServer.createContext(APPS_PREFIX,    this::handleApps);

            httpServer.start();
            log.info("API server listening on http://localhost:{}", getPort());
        } catch (IOException e) {
            throw new NavigationException("Failed to start API server on port " + port, e);
        }
    }

    public void stop() {
        if (httpServer != null) {
            httpServer.stop(1);
            log.info("API server stopped");
        }
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    /** Bound port; differs from the constructor argument when that was 0. */
    public int getPort() {
        return httpServer != null ? httpServer.getAddress().getPort() : port;
    }

    // ── Routing ──────────────────────────────────────────────────────────────

    /** /api/devices and /api/devices/{serial}/{action...} */
    private void handleDevices(HttpExchange exchange) throws IOException {
        if (handleCors(exchange)) return;
        String path = exchange.getRequestURI().getPath();
        String rest = path.substring(DEVICES_PREFIX.length());
        try {
            if (rest.isEmpty() || rest.equals("/")) {
                if (!assertMethod(exchange, "GET")) return;
                sendJson(exchange, 200, Map.of("devices", service.listDevices()));
                return;
            }
            String[] parts = rest.substring(1).split("/", 2);
            String serial = decode(parts[0]);
            String action = parts.length > 1 ? parts[1] : "";

            switch (action) {
                case "screen"         -> handleScreen(exchange, serial);
                case "navigate"       -> handleNavigate(exchange, serial);
                case "recover"        -> handleRecover(exchange, serial);
                case "stats"          -> handleStats(exchange, serial);
                case "signature-dump" -> handleSignatureDump(exchange, serial);
                case "popups/check"   -> handlePopupCheck(exchange, serial);
                default               -> sendError(exchange, 404, "Not found: " + path);
            }
        } catch (Exception e) {
            handleFailure(exchange, e);
        }
    }

    /** /api/apps/{app}/{graph|screens|signatures} */
    private void handleApps(HttpExchange exchange) throws IOException {
        if (handleCors(exchange)) return;
        String path = exchange.getRequestURI().getPath();
        String[] parts = path.substring(APPS_PREFIX.length()).split("/", 2);
        try {
            if (parts[0].isEmpty() || parts.length < 2) {
                sendError(exchange, 404, "Not found: " + path);
                return;
            }
            String appId = decode(parts[0]);
            switch (parts[1]) {
                case "graph"      -> handleGraph(exchange, appId);
                case "screens"    -> handleScreens(exchange, appId);
                case "signatures" -> handleRegisterSignatures(exchange, appId);
                default           -> sendError(exchange, 404, "Not found: " + path);
            }
        } catch (Exception e) {
            handleFailure(exchange, e);
        }
    }

    // ── Device handlers ──────────────────────────────────────────────────────

    /** GET /api/devices/{serial}/screen?app=instagram&amp;refresh=true */
    private void handleScreen(HttpExchange exchange, String serial) throws IOException {
        if (!assertMethod(exchange, "GET")) return;
        Map<String, String> query = query(exchange);
        String app = query.get("app");
        if (app == null || app.isBlank()) {
            sendError(exchange, 400, "Missing required query parameter: app");
            return;
        }
        boolean refresh = Boolean.parseBoolean(query.getOrDefault("refresh", "false"));
        sendJson(exchange, 200, service.detectScreen(serial, app, refresh));
    }

    /** POST /api/devices/{serial}/navigate */
    private void handleNavigate(HttpExchange exchange, String serial) throws IOException {
        if (!assertMethod(exchange, "POST")) return;
        JsonNode body = readJsonBody(exchange);
        if (body == null) return;

        String app    = body.path("app").asText(null);
        String target = body.path("target").asText(null);
        if (app == null || target == null) {
            sendError(exchange, 400, "Missing required fields: app, target");
            return;
        }
        int maxAttempts = body.path("maxAttempts").asInt(service.getConfig().getMaxAttempts());
        boolean verify  = body.path("verifyEachStep").asBoolean(service.getConfig().isVerifyEachStep());

        NavigationResult result = service.navigateTo(serial, app, target, maxAttempts, verify,
                CancellationToken.none());
        sendJson(exchange, 200, result);
    }

    /** POST /api/devices/{serial}/recover */
    private void handleRecover(HttpExchange exchange, String serial) throws IOException {
        if (!assertMethod(exchange, "POST")) return;
        JsonNode body = readJsonBody(exchange);
        if (body == null) return;

        String app = body.path("app").asText(null);
        if (app == null) {
            sendError(exchange, 400, "Missing required field: app");
            return;
        }
        String context = body.path("context").asText("warmup");
        sendJson(exchange, 200, service.recoverToSafeState(serial, app, context));
    }

    /** GET /api/devices/{serial}/stats */
    private void handleStats(HttpExchange exchange, String serial) throws IOException {
        if (!assertMethod(exchange, "GET")) return;
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("serial", serial);
        body.put("detection", service.getDetectionStats(serial));
        body.put("navigation", service.getNavigationStats(serial));
        sendJson(exchange, 200, body);
    }

    /** GET /api/devices/{serial}/signature-dump */
    private void handleSignatureDump(HttpExchange exchange, String serial) throws IOException {
        if (!assertMethod(exchange, "GET")) return;
        sendJson(exchange, 200, service.dumpForSignature(serial));
    }

    /** POST /api/devices/{serial}/popups/check; an empty body checks the bundled patterns */
    private void handlePopupCheck(HttpExchange exchange, String serial) throws IOException {
        if (!assertMethod(exchange, "POST")) return;
        JsonNode body = readJsonBody(exchange);
        if (body == null) return;

        List<PopupPattern> patterns = body.has("patterns")
                ? mapper.convertValue(body.get("patterns"), new TypeReference<List<PopupPattern>>() {})
                : List.of();
        sendJson(exchange, 200, service.checkPatterns(serial, patterns));
    }

    // ── App handlers ─────────────────────────────────────────────────────────

    /** GET /api/apps/{app}/graph?from=explore_grid */
    private void handleGraph(HttpExchange exchange, String appId) throws IOException {
        if (!assertMethod(exchange, "GET")) return;
        sendJson(exchange, 200, service.getNavigationGraph(appId, query(exchange).get("from")));
    }

    /** GET /api/apps/{app}/screens?screen=home_feed */
    private void handleScreens(HttpExchange exchange, String appId) throws IOException {
        if (!assertMethod(exchange, "GET")) return;
        sendJson(exchange, 200, service.getScreenInfo(appId, query(exchange).get("screen")));
    }

    /** POST /api/apps/{app}/signatures; body is an array of signatures, replacing the app's set */
    private void handleRegisterSignatures(HttpExchange exchange, String appId) throws IOException {
        if (!assertMethod(exchange, "POST")) return;
        JsonNode body = readJsonBody(exchange);
        if (body == null) return;
        if (!body.isArray()) {
            sendError(exchange, 400, "Body must be a JSON array of signatures");
            return;
        }
        List<ScreenSignature> signatures =
                mapper.convertValue(body, new TypeReference<List<ScreenSignature>>() {});
        int count = service.registerSignatures(appId, signatures);

        ObjectNode resp = mapper.createObjectNode();
        resp.put("ok", true);
        resp.put("appId", appId);
        resp.put("registered", count);
        sendJson(exchange, 200, resp);
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    /** Maps service exceptions to HTTP status codes. */
    private void handleFailure(HttpExchange exchange, Exception e) throws IOException {
        if (e instanceof ScreenNotFoundException snf) {
            ObjectNode err = mapper.createObjectNode();
            err.put("error", snf.getMessage());
            err.putPOJO("availableScreens", snf.getAvailableScreens());
            sendJson(exchange, 404, err);
        } else if (e instanceof DeviceNotFoundException) {
            sendError(exchange, 404, e.getMessage());
        } else if (e instanceof DeviceBusyException) {
            sendError(exchange, 409, e.getMessage());
        } else if (e instanceof IllegalArgumentException) {
            // Also covers Jackson's conversion failures for malformed signatures and patterns
            sendError(exchange, 400, e.getMessage());
        } else {
            log.error("Request {} {} failed", exchange.getRequestMethod(), exchange.getRequestURI(), e);
            sendError(exchange, 500, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }

    /**
     * Sends CORS pre-flight OPTIONS response.
     * Returns true if this was an OPTIONS request (caller should return immediately).
     */
    private boolean handleCors(HttpExchange exchange) throws IOException {
        setCorsHeaders(exchange);
        if ("OPTIONS".equalsIgnoreCase(exchange.getRequestMethod())) {
            exchange.sendResponseHeaders(200, -1);
            exchange.close();
            return true;
        }
        return false;
    }

    /** Adds CORS headers to every response. */
    private void setCorsHeaders(HttpExchange exchange) {
        exchange.getResponseHeaders().set("Access-Control-Allow-Origin",  "*");
        exchange.getResponseHeaders().set("Access-Control-Allow-Methods", "GET, POST, OPTIONS");
        exchange.getResponseHeaders().set("Access-Control-Allow-Headers", "Content-Type");
    }

    /**
     * Checks that the request uses the expected HTTP method.
     * Returns true if ok; sends 405 and returns false otherwise.
     */
    private boolean assertMethod(HttpExchange exchange, String expected) throws IOException {
        if (!expected.equalsIgnoreCase(exchange.getRequestMethod())) {
            sendError(exchange, 405, "Method Not Allowed, expected " + expected);
            return false;
        }
        return true;
    }

    /**
     * Reads and parses the request body as JSON.
     * An empty body reads as an empty object; returns null and sends 400 if the JSON is invalid.
     */
    private JsonNode readJsonBody(HttpExchange exchange) throws IOException {
        byte[] raw = exchange.getRequestBody().readAllBytes();
        if (raw.length == 0) {
            return mapper.createObjectNode();
        }
        try {
            return mapper.readTree(raw);
        } catch (IOException e) {
            sendError(exchange, 400, "Invalid JSON body: " + e.getMessage());
            return null;
        }
    }

    private static Map<String, String> query(HttpExchange exchange) {
        Map<String, String> params = new LinkedHashMap<>();
        String raw = exchange.getRequestURI().getRawQuery();
        if (raw == null || raw.isEmpty()) return params;
        for (String pair : raw.split("&")) {
            int eq = pair.indexOf('=');
            if (eq < 0) {
                params.put(decode(pair), "");
            } else {
                params.put(decode(pair.substring(0, eq)), decode(pair.substring(eq + 1)));
            }
        }
        return params;
    }

    private static String decode(String s) {
        return URLDecoder.decode(s, StandardCharsets.UTF_8);
    }

    /**
     * Serializes {@code obj} with Jackson, sets Content-Type: application/json,
     * and writes the response.
     */
    private void sendJson(HttpExchange exchange, int status, Object obj) throws IOException {
        byte[] body = mapper.writeValueAsBytes(obj);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        setCorsHeaders(exchange);
        exchange.sendResponseHeaders(status, body.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(body);
        }
    }

    /** Sends a JSON error response: {"error":"<message>"}. */
    private void sendError(HttpExchange exchange, int status, String message) throws IOException {
        ObjectNode err = mapper.createObjectNode();
        err.put("error", message);
        sendJson(exchange, status, err);
    }
}
