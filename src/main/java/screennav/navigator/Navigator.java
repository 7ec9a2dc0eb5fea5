package screennav.navigator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import screennav.detect.ScreenDetector;
import screennav.device.DeviceDriver;
import screennav.device.DeviceUnavailableException;
import screennav.device.DriverException;
import screennav.graph.GraphRegistry;
import screennav.graph.NavigationGraph;
import screennav.graph.Pathfinder;
import screennav.model.NavigationAction;
import screennav.model.NavigationEdge;
import screennav.model.NavigationPath;
import screennav.model.NavigationResult;
import screennav.model.NavigationStatus;
import screennav.model.NavigationStep;
import screennav.model.SafeStateContext;
import screennav.model.ScreenDetectionResult;
import screennav.signature.SignatureStore;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Drives one device from its current screen to a target screen.
 *
 * <p>For each navigation the navigator:
 * <ol>
 *   <li>Detects the current screen (always a fresh dump).</li>
 *   <li>Plans the shortest path with {@link Pathfinder}.</li>
 *   <li>Executes each edge's actions through the {@link DeviceDriver}.</li>
 *   <li>Verifies the screen after each edge and re-plans from wherever it
 *       actually landed, up to {@code maxAttempts} deviations.</li>
 * </ol>
 *
 * <p>A failed action is not fatal: it forces a verification, which takes the
 * normal re-plan path. An unknown screen (loading spinner, slow transition)
 * costs one attempt and is dumped again after the settle delay; only a known
 * screen with no route ends in {@link NavigationStatus#NO_PATH}. A {@link DeviceUnavailableException} or a failed dump
 * ends the navigation at once with {@link NavigationStatus#FAILED}.
 */
public class Navigator {

    private static final Logger log = LoggerFactory.getLogger(Navigator.class);

    static final String CANCELED = "Navigation canceled";

    private static final String KNOWN_SCREEN = "a known screen";

    /** Blocking pause, replaced in tests. */
    @FunctionalInterface
    interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }

    private final DeviceDriver           driver;
    private final ScreenDetector         detector;
    private final GraphRegistry          graphs;
    private final SignatureStore         signatures;
    private final NavigatorConfig        config;
    private final NavigationStatsTracker stats;
    private final Sleeper                sleeper;

    // ── Constructor ───────────────────────────────────────────────────────

    public Navigator(DeviceDriver driver, ScreenDetector detector, GraphRegistry graphs,
                     SignatureStore signatures, NavigatorConfig config) {
        this(driver, detector, graphs, signatures, config, new NavigationStatsTracker(), Thread::sleep);
    }

    /**
     * Package-private constructor for unit tests; lets tests replace the
     * sleeper so settle delays do not slow the suite.
     */
    Navigator(DeviceDriver driver, ScreenDetector detector, GraphRegistry graphs,
              SignatureStore signatures, NavigatorConfig config,
              NavigationStatsTracker stats, Sleeper sleeper) {
        this.driver     = driver;
        this.detector   = detector;
        this.graphs     = graphs;
        this.signatures = signatures;
        this.config     = config;
        this.stats      = stats;
        this.sleeper    = sleeper;
    }

    // ── Navigation ────────────────────────────────────────────────────────

    /** Navigates with the configured attempt budget and verification mode. */
    public NavigationResult navigateTo(String appId, String target) {
        return navigateTo(appId, target, config.getMaxAttempts(), config.isVerifyEachStep(),
                CancellationToken.none());
    }

    /**
     * Navigates to {@code target}.
     *
     * @param maxAttempts    deviations tolerated before giving up
     * @param verifyEachStep detect after every edge instead of only at the end
     * @param cancel         checked between edges
     */
    public NavigationResult navigateTo(String appId, String target, int maxAttempts,
                                       boolean verifyEachStep, CancellationToken cancel) {
        Outcome outcome = navigate(appId, target, maxAttempts, verifyEachStep, cancel);
        return outcome.result();
    }

    private Outcome navigate(String appId, String target, int maxAttempts,
                             boolean verifyEachStep, CancellationToken cancel) {
        Run run = new Run(target);
        NavigationGraph graph = graphs.getOrEmpty(appId);

        Sighting start = sight(appId, detector.detect(appId, true), KNOWN_SCREEN, maxAttempts, run,
                ScreenDetectionResult.UNKNOWN_SCREEN);
        if (start.stop() != null) return start.stop();
        run.startScreen = start.screen();
        String current  = run.startScreen;

        if (current.equals(target)) {
            log.info("[{}] Already on {}", driver.getSerial(), target);
            return run.finish(NavigationStatus.ALREADY_THERE, current, null);
        }

        Optional<NavigationPath> planned = Pathfinder.findPath(graph, current, target);
        if (planned.isEmpty()) {
            return run.finish(NavigationStatus.NO_PATH, current, "No path from " + current + " to " + target);
        }
        NavigationPath path = planned.get();
        logPlan(path);

        int     index     = 0;
        boolean confirmed = true;
        while (true) {
            if (index == path.size()) {
                if (!confirmed) {
                    ScreenDetectionResult finalCheck = detector.detect(appId, true);
                    if (finalCheck.hasError()) {
                        return run.fatal(current, finalCheck.getError());
                    }
                    confirmed = true;
                    if (!finalCheck.getScreenId().equals(target)) {
                        Sighting landed = afterDeviation(appId, finalCheck, target, current, maxAttempts, run);
                        if (landed.stop() != null) return landed.stop();
                        String actual = landed.screen();
                        current = actual;
                        Optional<NavigationPath> replanned = Pathfinder.findPath(graph, actual, target);
                        if (replanned.isEmpty()) {
                            return run.finish(NavigationStatus.NO_PATH, actual,
                                    "No path from " + actual + " to " + target);
                        }
                        path  = replanned.get();
                        index = 0;
                        logPlan(path);
                        continue;
                    }
                }
                log.info("[{}] Reached {} in {} step(s), {} re-plan(s)",
                        driver.getSerial(), target, run.executed.size(), run.recoveryAttempts);
                return run.finish(NavigationStatus.SUCCESS, target, null);
            }

            if (cancel.isCanceled()) {
                log.warn("[{}] Navigation to {} canceled at {}", driver.getSerial(), target, current);
                return run.fatal(current, CANCELED);
            }

            NavigationStep step = path.getSteps().get(index);
            log.info("[{}] Step {}/{}: {}", driver.getSerial(), index + 1, path.size(), step.summary());

            boolean actionsOk;
            try {
                actionsOk = executeEdge(step.edge());
            } catch (DeviceUnavailableException e) {
                log.error("[{}] Device unavailable during {}: {}", driver.getSerial(), step.summary(), e.getMessage());
                return run.fatal(current, "Device unavailable: " + e.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return run.fatal(current, CANCELED);
            }
            run.executed.add(step.summary());
            stats.recordStep();
            current   = step.toScreen();
            confirmed = false;

            if (verifyEachStep || !actionsOk) {
                if (!pause(config.getSettleDelayMs())) {
                    return run.fatal(current, CANCELED);
                }
                ScreenDetectionResult verify = detector.detect(appId, true);
                if (verify.hasError()) {
                    return run.fatal(current, verify.getError());
                }
                confirmed = true;
                if (!verify.getScreenId().equals(step.toScreen())) {
                    Sighting landed = afterDeviation(appId, verify, step.toScreen(), current, maxAttempts, run);
                    if (landed.stop() != null) return landed.stop();
                    String actual = landed.screen();
                    current = actual;
                    Optional<NavigationPath> replanned = Pathfinder.findPath(graph, actual, target);
                    if (replanned.isEmpty()) {
                        return run.finish(NavigationStatus.NO_PATH, actual,
                                "No path from " + actual + " to " + target);
                    }
                    path  = replanned.get();
                    index = 0;
                    if (!path.isEmpty()) logPlan(path);
                    continue;
                }
            }
            index++;
        }
    }

    /**
     * Counts a verification that did not land on {@code expected}. An unknown
     * screen is re-detected after the settle delay until it resolves.
     */
    private Sighting afterDeviation(String appId, ScreenDetectionResult seen, String expected,
                                    String lastKnown, int maxAttempts, Run run) {
        Outcome failed = run.deviate(expected, seen.getScreenId(), maxAttempts);
        if (failed != null) return Sighting.stopped(failed);
        if (!seen.isUnknown()) return Sighting.at(seen.getScreenId());
        if (!pause(config.getSettleDelayMs())) return Sighting.stopped(run.fatal(lastKnown, CANCELED));
        return sight(appId, detector.detect(appId, true), expected, maxAttempts, run, lastKnown);
    }

    /**
     * Resolves {@code detection} to a known screen. Each unknown result costs
     * one attempt, then waits the settle delay and dumps again.
     */
    private Sighting sight(String appId, ScreenDetectionResult detection, String expected,
                           int maxAttempts, Run run, String lastKnown) {
        while (true) {
            if (detection.hasError()) {
                return Sighting.stopped(run.fatal(lastKnown, detection.getError()));
            }
            if (!detection.isUnknown()) {
                return Sighting.at(detection.getScreenId());
            }
            Outcome failed = run.deviate(expected, detection.getScreenId(), maxAttempts);
            if (failed != null) return Sighting.stopped(failed);
            if (!pause(config.getSettleDelayMs())) {
                return Sighting.stopped(run.fatal(lastKnown, CANCELED));
            }
            detection = detector.detect(appId, true);
        }
    }

    // ── Safe-state recovery ───────────────────────────────────────────────

    public NavigationResult recoverToSafeState(String appId, String context) {
        return recoverToSafeState(appId, context, CancellationToken.none());
    }

    /**
     * Brings the device to one of the screens of a safe-state context: the
     * preferred screen first, then each fallback in order.
     *
     * @return {@code ALREADY_THERE} if the current screen is already safe,
     *         the first successful navigation, or the last failed one
     */
    public NavigationResult recoverToSafeState(String appId, String context, CancellationToken cancel) {
        List<String> targets = resolveSafeTargets(appId, context);
        if (targets.isEmpty()) {
            return new NavigationResult(NavigationStatus.NO_PATH, ScreenDetectionResult.UNKNOWN_SCREEN,
                    null, ScreenDetectionResult.UNKNOWN_SCREEN, 0, List.of(), 0.0, 0,
                    "No safe states declared for app " + appId);
        }
        log.info("[{}] Recovering to safe state (context: {}, targets: {})", driver.getSerial(), context, targets);

        long start = System.nanoTime();
        ScreenDetectionResult detection = detector.detect(appId, true);
        if (detection.hasError()) {
            return new NavigationResult(NavigationStatus.FAILED, ScreenDetectionResult.UNKNOWN_SCREEN,
                    targets.get(0), ScreenDetectionResult.UNKNOWN_SCREEN, 0, List.of(),
                    elapsedSeconds(start), 0, detection.getError());
        }
        String current = detection.getScreenId();
        if (targets.contains(current)) {
            log.info("[{}] Already in safe state: {}", driver.getSerial(), current);
            return new NavigationResult(NavigationStatus.ALREADY_THERE, current, current, current,
                    0, List.of(), elapsedSeconds(start), 0, null);
        }

        NavigationGraph graph = graphs.getOrEmpty(appId);
        List<String> remaining = new ArrayList<>(targets);
        NavigationResult last = null;
        while (!remaining.isEmpty()) {
            String target = nextSafeTarget(graph, last, remaining);
            remaining.remove(target);
            Outcome outcome = navigate(appId, target, config.getRecoveryMaxAttempts(),
                    config.isVerifyEachStep(), cancel);
            last = outcome.result();
            if (last.isSuccess()) {
                return last;
            }
            if (outcome.fatal()) {
                log.warn("[{}] Recovery stopped: {}", driver.getSerial(), last.getErrorMessage());
                break;
            }
            log.info("[{}] Safe target {} not reached ({}), trying next", driver.getSerial(), target, last.getStatus());
        }
        return last;
    }

    /**
     * The preferred screen first; after a miss, the remaining target nearest
     * to where the device ended up, else the next one in declared order.
     */
    private static String nextSafeTarget(NavigationGraph graph, NavigationResult last, List<String> remaining) {
        if (last == null || ScreenDetectionResult.UNKNOWN_SCREEN.equals(last.getFinalScreen())) {
            return remaining.get(0);
        }
        String from = last.getFinalScreen();
        return Pathfinder.findPathToAny(graph, from, remaining)
                .map(p -> p.isEmpty() ? from : p.getDestination())
                .orElse(remaining.get(0));
    }

    /**
     * Ordered targets of a safe-state context: the named context, else the
     * graph's default context, else the screens flagged safe in the signatures.
     */
    public List<String> resolveSafeTargets(String appId, String context) {
        NavigationGraph graph = graphs.getOrEmpty(appId);
        Optional<SafeStateContext> ctx = context != null ? graph.getContext(context) : Optional.empty();
        if (ctx.isEmpty()) {
            ctx = graph.getDefaultContext();
            ctx.ifPresent(c -> log.debug("Unknown safe-state context '{}' for {}, using '{}'", context, appId, c.name()));
        }
        if (ctx.isPresent()) {
            return ctx.get().orderedTargets();
        }
        return signatures.getSafeStates(appId);
    }

    public NavigationStats getStats() {
        return stats.snapshot(graphs.totalSourceScreens());
    }

    // ── Execution ─────────────────────────────────────────────────────────

    /**
     * Runs the edge's actions in order, stopping at the first failure.
     *
     * @return false if an action failed
     */
    private boolean executeEdge(NavigationEdge edge) throws DeviceUnavailableException, InterruptedException {
        for (NavigationAction action : edge.getActions()) {
            try {
                switch (action.type()) {
                    case WAIT -> sleeper.sleep(toMillis(((NavigationAction.Wait) action).seconds()));
                    case PRESS_BACK, CLICK_BY_TEXT, CLICK_BY_LABEL, CLICK_BY_SELECTOR, SWIPE,
                         LAUNCH_APP, PRESS_KEY, ENTER_TEXT -> {
                        log.debug("[{}] {}", driver.getSerial(), action.describe());
                        driver.execute(action);
                        if (action.waitAfterSeconds() > 0) {
                            sleeper.sleep(toMillis(action.waitAfterSeconds()));
                        }
                    }
                }
            } catch (DeviceUnavailableException e) {
                throw e;
            } catch (DriverException e) {
                log.warn("[{}] Action failed ({}): {}", driver.getSerial(), action.describe(), e.getMessage());
                return false;
            }
        }
        return true;
    }

    private boolean pause(long millis) {
        if (millis <= 0) return true;
        try {
            sleeper.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private void logPlan(NavigationPath path) {
        log.info("[{}] Path found: {} step(s), reliability={}%", driver.getSerial(), path.size(),
                String.format("%.1f", path.getEstimatedReliability() * 100));
    }

    private static long toMillis(double seconds) {
        return Math.round(seconds * 1000);
    }

    private static double elapsedSeconds(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000_000.0;
    }

    // ── Per-call state ────────────────────────────────────────────────────

    /** A result plus whether it must stop any fallback loop (device gone, canceled). */
    private record Outcome(NavigationResult result, boolean fatal) {}

    /** Either the known screen the device is on, or the outcome that ended the run. */
    private record Sighting(String screen, Outcome stop) {
        static Sighting at(String screen)        { return new Sighting(screen, null); }
        static Sighting stopped(Outcome outcome) { return new Sighting(null, outcome); }
    }

    /** Mutable bookkeeping of one {@code navigate} call. */
    private final class Run {
        final String       target;
        final long         startNanos = System.nanoTime();
        final List<String> executed   = new ArrayList<>();
        String             startScreen = ScreenDetectionResult.UNKNOWN_SCREEN;
        int                recoveryAttempts;

        Run(String target) {
            this.target = target;
        }

        /**
         * Counts a deviation from {@code expected}.
         *
         * @return the failed outcome when the attempt budget is spent, else null
         */
        Outcome deviate(String expected, String actual, int maxAttempts) {
            recoveryAttempts++;
            log.warn("[{}] Deviated: expected {}, got {} ({}/{})",
                    driver.getSerial(), expected, actual, recoveryAttempts, maxAttempts);
            if (recoveryAttempts >= maxAttempts) {
                return finish(NavigationStatus.FAILED, actual,
                        "Failed after " + recoveryAttempts + " deviation(s); expected " + expected + ", got " + actual);
            }
            return null;
        }

        Outcome finish(NavigationStatus status, String finalScreen, String error) {
            NavigationResult result = build(status, finalScreen, error);
            stats.recordNavigation(result.isSuccess(), result.getTotalTimeSeconds());
            if (!result.isSuccess()) {
                log.warn("[{}] Navigation to {} ended {}: {}", driver.getSerial(), target, status, error);
            }
            return new Outcome(result, false);
        }

        Outcome fatal(String finalScreen, String error) {
            NavigationResult result = build(NavigationStatus.FAILED, finalScreen, error);
            stats.recordNavigation(false, result.getTotalTimeSeconds());
            log.error("[{}] Navigation to {} failed: {}", driver.getSerial(), target, error);
            return new Outcome(result, true);
        }

        private NavigationResult build(NavigationStatus status, String finalScreen, String error) {
            return new NavigationResult(status, startScreen, target, finalScreen, executed.size(),
                    executed, elapsedSeconds(startNanos), recoveryAttempts, error);
        }
    }
}
