package screennav.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import screennav.detect.DetectionStats;
import screennav.detect.PopupPatternChecker;
import screennav.detect.ScreenDetector;
import screennav.device.DeviceDriver;
import screennav.device.DeviceRegistry;
import screennav.device.DriverException;
import screennav.graph.GraphRegistry;
import screennav.graph.NavigationGraph;
import screennav.model.AppCatalog;
import screennav.model.CatalogIO;
import screennav.model.NavigationResult;
import screennav.model.PatternMatch;
import screennav.model.PopupPattern;
import screennav.model.SafeStateContext;
import screennav.model.ScreenDetectionResult;
import screennav.model.ScreenSignature;
import screennav.model.SignatureDump;
import screennav.navigator.CancellationToken;
import screennav.navigator.NavigationException;
import screennav.navigator.NavigationStats;
import screennav.navigator.Navigator;
import screennav.navigator.NavigatorConfig;
import screennav.signature.SignatureStore;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Entry point for every front end (HTTP API, CLI, scripts).
 *
 * <p>Owns the shared, read-mostly {@link SignatureStore} and
 * {@link GraphRegistry}, and one {@link DeviceSession} per device serial.
 * Device-bound operations run under that session's lock; catalog queries
 * need no device and no lock.
 */
public class ScreenNavigationService {

    private static final Logger log = LoggerFactory.getLogger(ScreenNavigationService.class);

    private final DeviceRegistry  devices;
    private final SignatureStore  signatures;
    private final GraphRegistry   graphs;
    private final NavigatorConfig config;
    private final Clock           clock;
    private final List<PopupPattern> defaultPopupPatterns;

    private final Map<String, DeviceSession> sessions = new ConcurrentHashMap<>();

    // ── Construction ──────────────────────────────────────────────────────

    public ScreenNavigationService(DeviceRegistry devices, SignatureStore signatures,
                                   GraphRegistry graphs, NavigatorConfig config) {
        this(devices, signatures, graphs, config, Clock.systemUTC(), PopupPatternChecker.defaultPatterns());
    }

    public ScreenNavigationService(DeviceRegistry devices, SignatureStore signatures, GraphRegistry graphs,
                                   NavigatorConfig config, Clock clock, List<PopupPattern> defaultPopupPatterns) {
        this.devices              = devices;
        this.signatures           = signatures;
        this.graphs               = graphs;
        this.config               = config;
        this.clock                = clock;
        this.defaultPopupPatterns = List.copyOf(defaultPopupPatterns);
    }

    /**
     * Builds a service with the catalogs listed in {@code catalog.resources}
     * already loaded.
     *
     * @throws NavigationException if a catalog cannot be read or is invalid
     */
    public static ScreenNavigationService create(DeviceRegistry devices, NavigatorConfig config) {
        ScreenNavigationService service = new ScreenNavigationService(devices,
                new SignatureStore(config.getSharedAppId()), new GraphRegistry(), config);
        for (String resource : config.getCatalogResources()) {
            try {
                service.loadCatalog(CatalogIO.readResource(resource));
            } catch (IOException | RuntimeException e) {
                throw new NavigationException("Cannot load catalog " + resource + ": " + e.getMessage(), e);
            }
        }
        return service;
    }

    /** Registers a catalog's signatures and, when it has edges or contexts, its graph. */
    public void loadCatalog(AppCatalog catalog) {
        signatures.register(catalog.getAppId(), catalog.boundSignatures());
        if (!catalog.getGraph().isEmpty() || !catalog.getSafeStateContexts().isEmpty()) {
            graphs.register(NavigationGraph.fromCatalog(catalog));
        }
    }

    // ── Devices ───────────────────────────────────────────────────────────

    public List<String> listDevices() {
        return devices.serials();
    }

    // ── Detection ─────────────────────────────────────────────────────────

    public ScreenDetectionResult detectScreen(String serial, String appId, boolean forceRefresh) {
        requireApp(appId);
        DeviceSession s = session(serial);
        return s.withLock(config.getDeviceLockTimeoutMs(), () -> s.getDetector().detect(appId, forceRefresh));
    }

    /**
     * Fresh dump grouped by element kind, for authoring a signature.
     *
     * @throws NavigationException if the dump failed
     */
    public SignatureDump dumpForSignature(String serial) {
        DeviceSession s = session(serial);
        return s.withLock(config.getDeviceLockTimeoutMs(), () -> {
            try {
                return s.getDetector().dumpForSignature();
            } catch (DriverException e) {
                throw new NavigationException("Failed to dump hierarchy on " + serial + ": " + e.getMessage(), e);
            }
        });
    }

    public DetectionStats getDetectionStats(String serial) {
        return session(serial).getDetector().getStats();
    }

    /**
     * Checks the current screen for known popups.
     *
     * @param patterns patterns to check; null or empty uses the bundled defaults
     */
    public PopupCheckResult checkPatterns(String serial, List<PopupPattern> patterns) {
        List<PopupPattern> toCheck = patterns == null || patterns.isEmpty() ? defaultPopupPatterns : patterns;
        DeviceSession s = session(serial);
        return s.withLock(config.getDeviceLockTimeoutMs(), () -> {
            try {
                ScreenDetector detector = s.getDetector();
                PopupPatternChecker checker = new PopupPatternChecker(detector.getScorer());
                List<PatternMatch> found = checker.check(detector.elements(false), toCheck);
                return PopupCheckResult.of(found, toCheck.size());
            } catch (DriverException e) {
                throw new NavigationException("Failed to dump hierarchy on " + serial + ": " + e.getMessage(), e);
            }
        });
    }

    // ── Navigation ────────────────────────────────────────────────────────

    public NavigationResult navigateTo(String serial, String appId, String target) {
        return navigateTo(serial, appId, target, config.getMaxAttempts(), config.isVerifyEachStep(),
                CancellationToken.none());
    }

    public NavigationResult navigateTo(String serial, String appId, String target, int maxAttempts,
                                       boolean verifyEachStep, CancellationToken cancel) {
        requireApp(appId);
        if (target == null || target.isBlank()) {
            throw new IllegalArgumentException("target screen is required");
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1: " + maxAttempts);
        }
        DeviceSession s = session(serial);
        return s.withLock(config.getDeviceLockTimeoutMs(),
                () -> s.getNavigator().navigateTo(appId, target, maxAttempts, verifyEachStep, cancel));
    }

    public NavigationResult recoverToSafeState(String serial, String appId, String context) {
        return recoverToSafeState(serial, appId, context, CancellationToken.none());
    }

    public NavigationResult recoverToSafeState(String serial, String appId, String context,
                                               CancellationToken cancel) {
        requireApp(appId);
        DeviceSession s = session(serial);
        return s.withLock(config.getDeviceLockTimeoutMs(),
                () -> s.getNavigator().recoverToSafeState(appId, context, cancel));
    }

    public NavigationStats getNavigationStats(String serial) {
        return session(serial).getNavigator().getStats();
    }

    // ── Catalog queries ───────────────────────────────────────────────────

    /**
     * Whole-graph summary when {@code fromScreen} is null, otherwise the
     * outgoing edges of that screen (empty for terminal screens).
     */
    public GraphView getNavigationGraph(String appId, String fromScreen) {
        NavigationGraph graph = graphs.getOrEmpty(appId);
        if (fromScreen != null && !fromScreen.isBlank()) {
            List<GraphView.EdgeInfo> edges = graph.edgesFrom(fromScreen).stream()
                    .map(GraphView.EdgeInfo::of)
                    .toList();
            return new GraphView.Edges(appId, fromScreen, edges, edges.size());
        }
        List<String> safe = safeStates(appId, graph);
        List<String> sources = graph.sourceScreens().stream().sorted().toList();
        List<String> contexts = graph.getContexts().stream().map(SafeStateContext::name).toList();
        return new GraphView.Summary(appId, sources.size(),
                graph.allScreens(safe).stream().sorted().toList(), safe, contexts);
    }

    /**
     * Screens of an app when {@code screenId} is null, otherwise that screen's signature.
     *
     * @throws ScreenNotFoundException if {@code screenId} is not registered for the app
     */
    public ScreenInfo getScreenInfo(String appId, String screenId) {
        if (screenId != null && !screenId.isBlank()) {
            return signatures.find(appId, screenId)
                    .<ScreenInfo>map(ScreenInfo.Detail::new)
                    .orElseThrow(() -> new ScreenNotFoundException(appId, screenId, signatures.screenIds(appId)));
        }
        List<String> screens = signatures.screenIds(appId);
        return new ScreenInfo.Listing(appId, screens, signatures.getSafeStates(appId),
                screens.size(), signatures.appIds());
    }

    /**
     * Replaces the signatures of {@code appId}. Cached dumps stay valid; only
     * the scoring changes.
     *
     * @return number of signatures registered
     */
    public int registerSignatures(String appId, List<ScreenSignature> newSignatures) {
        signatures.register(appId, newSignatures);
        return newSignatures.size();
    }

    public SignatureStore getSignatureStore() { return signatures; }
    public GraphRegistry getGraphRegistry()   { return graphs; }
    public NavigatorConfig getConfig()        { return config; }

    // ── Internals ─────────────────────────────────────────────────────────

    DeviceSession session(String serial) {
        DeviceSession existing = sessions.get(serial);
        if (existing != null) return existing;
        DeviceDriver driver = devices.find(serial).orElseThrow(() -> new DeviceNotFoundException(serial));
        return sessions.computeIfAbsent(serial, k -> {
            ScreenDetector detector = new ScreenDetector(driver, signatures, config, clock);
            Navigator navigator = new Navigator(driver, detector, graphs, signatures, config);
            log.info("Opened session for device {}", serial);
            return new DeviceSession(driver, detector, navigator);
        });
    }

    private void requireApp(String appId) {
        if (appId == null || appId.isBlank()) {
            throw new IllegalArgumentException("appId is required");
        }
    }

    private List<String> safeStates(String appId, NavigationGraph graph) {
        Set<String> safe = new LinkedHashSet<>(signatures.getSafeStates(appId));
        graph.getContexts().forEach(c -> safe.addAll(c.orderedTargets()));
        return new ArrayList<>(safe);
    }
}
