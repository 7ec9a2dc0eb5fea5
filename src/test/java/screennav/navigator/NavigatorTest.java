package screennav.navigator;

import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;
import screennav.detect.ScreenDetector;
import screennav.device.DeviceDriver;
import screennav.device.DeviceUnavailableException;
import screennav.device.DriverException;
import screennav.graph.GraphRegistry;
import screennav.graph.NavigationGraph;
import screennav.model.NavigationAction;
import screennav.model.NavigationEdge;
import screennav.model.NavigationResult;
import screennav.model.NavigationStatus;
import screennav.model.SafeStateContext;
import screennav.model.ScreenDetectionResult;
import screennav.model.ScreenSignature;
import screennav.signature.SignatureStore;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link Navigator}.
 *
 * <p>The detector is mocked to script which screen the device reports after
 * each step; the driver mock records executed actions. Sleeps are no-ops.
 *
 * <p>Graph under test:
 * <pre>
 *   A → B → C
 *   D → C
 *   X → Q
 * </pre>
 */
public class NavigatorTest {

    private static final String APP = "app";

    @Mock DeviceDriver driver;
    @Mock ScreenDetector detector;

    private AutoCloseable mocks;
    private GraphRegistry graphs;
    private SignatureStore signatures;
    private NavigationStatsTracker stats;
    private final List<Long> sleeps = new ArrayList<>();
    private Navigator navigator;

    @BeforeMethod
    public void setUp() {
        mocks = MockitoAnnotations.openMocks(this);
        when(driver.getSerial()).thenReturn("emulator-5554");

        Map<String, List<NavigationEdge>> edges = new LinkedHashMap<>();
        edges.put("A", List.of(edge("B")));
        edges.put("B", List.of(edge("C")));
        edges.put("D", List.of(edge("C")));
        edges.put("X", List.of(edge("Q")));
        graphs = new GraphRegistry();
        graphs.register(new NavigationGraph(APP, edges,
                List.of(new SafeStateContext("warmup", "P", List.of("Q")),
                        new SafeStateContext("nearest", "P", List.of("C", "B"))), "warmup"));

        signatures = new SignatureStore("android_system");
        signatures.register(APP, List.of(
                ScreenSignature.builder(null, "C").required(":id/c").safeState(true).build()));

        Properties p = new Properties();
        p.setProperty("navigator.settle.delay.ms", "250");
        p.setProperty("navigator.recovery.max.attempts", "2");
        stats = new NavigationStatsTracker();
        sleeps.clear();
        navigator = new Navigator(driver, detector, graphs, signatures, new NavigatorConfig(p),
                stats, sleeps::add);
    }

    @AfterMethod
    public void tearDown() throws Exception {
        mocks.close();
    }

    private static NavigationEdge edge(String to) {
        return new NavigationEdge(to, List.of(NavigationAction.clickLabel("Go " + to)), "to " + to);
    }

    private static ScreenDetectionResult on(String screen) {
        return ScreenDetectionResult.builder(APP, screen).confidence(1.0).build();
    }

    private void screens(String first, String... rest) {
        ScreenDetectionResult[] more = new ScreenDetectionResult[rest.length];
        for (int i = 0; i < rest.length; i++) more[i] = on(rest[i]);
        when(detector.detect(eq(APP), anyBoolean())).thenReturn(on(first), more);
    }

    // ── navigateTo ────────────────────────────────────────────────────────

    @Test(description = "A to C through B succeeds with both steps in the summary")
    public void testSuccess() throws Exception {
        screens("A", "B", "C");

        NavigationResult r = navigator.navigateTo(APP, "C", 3, true, CancellationToken.none());

        assertThat(r.getStatus()).isEqualTo(NavigationStatus.SUCCESS);
        assertThat(r.getStartScreen()).isEqualTo("A");
        assertThat(r.getFinalScreen()).isEqualTo("C");
        assertThat(r.getStepsCompleted()).isEqualTo(2);
        assertThat(r.getPathSummary()).containsExactly("A → B", "B → C");
        assertThat(r.getRecoveryAttempts()).isZero();
        assertThat(r.getErrorMessage()).isNull();
        verify(driver, times(2)).execute(any());
        verify(detector, times(3)).detect(APP, true);
    }

    @Test(description = "Settle delay and action wait are honoured through the sleeper")
    public void testSleeps() {
        screens("A", "B", "C");

        navigator.navigateTo(APP, "C", 3, true, CancellationToken.none());

        // click_by_label waits 1.0s after the tap, then the settle delay before verifying
        assertThat(sleeps).containsExactly(1000L, 250L, 1000L, 250L);
    }

    @Test(description = "Landing on D instead of B counts one re-plan and continues from D")
    public void testDeviationReplans() {
        screens("A", "D", "C");

        NavigationResult r = navigator.navigateTo(APP, "C", 3, true, CancellationToken.none());

        assertThat(r.getStatus()).isEqualTo(NavigationStatus.SUCCESS);
        assertThat(r.getRecoveryAttempts()).isEqualTo(1);
        assertThat(r.getPathSummary()).containsExactly("A → B", "D → C");
    }

    @Test(description = "Deviations beyond the attempt budget fail the navigation")
    public void testAttemptBudgetExhausted() {
        screens("A", "A", "A", "A");

        NavigationResult r = navigator.navigateTo(APP, "C", 2, true, CancellationToken.none());

        assertThat(r.getStatus()).isEqualTo(NavigationStatus.FAILED);
        assertThat(r.getRecoveryAttempts()).isEqualTo(2);
        assertThat(r.getFinalScreen()).isEqualTo("A");
        assertThat(r.getErrorMessage()).contains("expected B, got A");
    }

    @Test(description = "No path leaves the final screen equal to the start")
    public void testNoPath() throws Exception {
        screens("C");

        NavigationResult r = navigator.navigateTo(APP, "A", 3, true, CancellationToken.none());

        assertThat(r.getStatus()).isEqualTo(NavigationStatus.NO_PATH);
        assertThat(r.getFinalScreen()).isEqualTo(r.getStartScreen()).isEqualTo("C");
        assertThat(r.getErrorMessage()).isEqualTo("No path from C to A");
        verify(driver, never()).execute(any());
    }

    @Test(description = "Already on the target: no action is executed")
    public void testAlreadyThere() throws Exception {
        screens("C");

        NavigationResult r = navigator.navigateTo(APP, "C", 3, true, CancellationToken.none());

        assertThat(r.getStatus()).isEqualTo(NavigationStatus.ALREADY_THERE);
        assertThat(r.isSuccess()).isTrue();
        assertThat(r.getStepsCompleted()).isZero();
        verify(driver, never()).execute(any());
    }

    @Test(description = "An unknown start screen costs one attempt and is detected again after the settle delay")
    public void testUnknownStartRetried() throws Exception {
        screens(ScreenDetectionResult.UNKNOWN_SCREEN, "A", "B", "C");

        NavigationResult r = navigator.navigateTo(APP, "C", 3, true, CancellationToken.none());

        assertThat(r.getStatus()).isEqualTo(NavigationStatus.SUCCESS);
        assertThat(r.getStartScreen()).isEqualTo("A");
        assertThat(r.getRecoveryAttempts()).isEqualTo(1);
        assertThat(r.getPathSummary()).containsExactly("A → B", "B → C");
        assertThat(sleeps).startsWith(250L);
        verify(detector, times(4)).detect(APP, true);
    }

    @Test(description = "An unknown screen mid-path is detected again and the path re-planned from where it settles")
    public void testUnknownMidPathRetried() throws Exception {
        screens("A", ScreenDetectionResult.UNKNOWN_SCREEN, "B", "C");

        NavigationResult r = navigator.navigateTo(APP, "C", 3, true, CancellationToken.none());

        assertThat(r.getStatus()).isEqualTo(NavigationStatus.SUCCESS);
        assertThat(r.getFinalScreen()).isEqualTo("C");
        assertThat(r.getRecoveryAttempts()).isEqualTo(1);
        assertThat(r.getPathSummary()).containsExactly("A → B", "B → C");
        assertThat(sleeps).containsExactly(1000L, 250L, 250L, 1000L, 250L);
        verify(driver, times(2)).execute(any());
    }

    @Test(description = "A screen that stays unknown fails once the attempt budget is spent")
    public void testUnknownExhaustsBudget() throws Exception {
        screens(ScreenDetectionResult.UNKNOWN_SCREEN, ScreenDetectionResult.UNKNOWN_SCREEN,
                ScreenDetectionResult.UNKNOWN_SCREEN);

        NavigationResult r = navigator.navigateTo(APP, "C", 2, true, CancellationToken.none());

        assertThat(r.getStatus()).isEqualTo(NavigationStatus.FAILED);
        assertThat(r.getRecoveryAttempts()).isEqualTo(2);
        assertThat(r.getFinalScreen()).isEqualTo(ScreenDetectionResult.UNKNOWN_SCREEN);
        assertThat(r.getErrorMessage()).isEqualTo("Failed after 2 deviation(s); expected a known screen, got unknown");
        verify(detector, times(2)).detect(APP, true);
        verify(driver, never()).execute(any());
    }

    @Test(description = "Unknown after the last edge is detected again before the final check")
    public void testUnknownAtEndRetried() throws Exception {
        screens("B", ScreenDetectionResult.UNKNOWN_SCREEN, "C");

        NavigationResult r = navigator.navigateTo(APP, "C", 3, false, CancellationToken.none());

        assertThat(r.getStatus()).isEqualTo(NavigationStatus.SUCCESS);
        assertThat(r.getRecoveryAttempts()).isEqualTo(1);
        verify(driver, times(1)).execute(any());
    }

    @Test(description = "A failed dump ends the navigation as FAILED")
    public void testDetectionError() {
        when(detector.detect(APP, true)).thenReturn(ScreenDetectionResult.failed(APP, "Failed to dump UI hierarchy: x", 1.0));

        NavigationResult r = navigator.navigateTo(APP, "C", 3, true, CancellationToken.none());

        assertThat(r.getStatus()).isEqualTo(NavigationStatus.FAILED);
        assertThat(r.getErrorMessage()).startsWith("Failed to dump UI hierarchy");
    }

    @Test(description = "Without per-step verification only the end of the path is checked")
    public void testVerifyAtEndOnly() throws Exception {
        screens("A", "C");

        NavigationResult r = navigator.navigateTo(APP, "C", 3, false, CancellationToken.none());

        assertThat(r.getStatus()).isEqualTo(NavigationStatus.SUCCESS);
        verify(detector, times(2)).detect(APP, true);
        verify(driver, times(2)).execute(any());
    }

    @Test(description = "A failed action forces verification and re-plans from the actual screen")
    public void testActionFailureForcesVerify() throws Exception {
        screens("A", "A", "C");
        doThrow(new DriverException("element not found")).doNothing().when(driver).execute(any());

        NavigationResult r = navigator.navigateTo(APP, "C", 3, false, CancellationToken.none());

        assertThat(r.getStatus()).isEqualTo(NavigationStatus.SUCCESS);
        assertThat(r.getRecoveryAttempts()).isEqualTo(1);
        assertThat(r.getPathSummary()).containsExactly("A → B", "A → B", "B → C");
        verify(driver, times(3)).execute(any());
    }

    @Test(description = "A device that disappears fails the navigation immediately")
    public void testDeviceUnavailable() throws Exception {
        screens("A");
        doThrow(new DeviceUnavailableException("device offline")).when(driver).execute(any());

        NavigationResult r = navigator.navigateTo(APP, "C", 3, true, CancellationToken.none());

        assertThat(r.getStatus()).isEqualTo(NavigationStatus.FAILED);
        assertThat(r.getErrorMessage()).isEqualTo("Device unavailable: device offline");
        assertThat(r.getStepsCompleted()).isZero();
    }

    @Test(description = "A canceled token stops before the next edge")
    public void testCanceled() throws Exception {
        screens("A");
        CancellationToken token = new CancellationToken();
        token.cancel();

        NavigationResult r = navigator.navigateTo(APP, "C", 3, true, token);

        assertThat(r.getStatus()).isEqualTo(NavigationStatus.FAILED);
        assertThat(r.getErrorMessage()).isEqualTo(Navigator.CANCELED);
        verify(driver, never()).execute(any());
    }

    @Test(description = "Wait actions sleep locally without touching the driver")
    public void testWaitAction() throws Exception {
        Map<String, List<NavigationEdge>> edges = Map.of("A",
                List.of(new NavigationEdge("B", List.of(NavigationAction.waitFor(2.5)), "wait")));
        graphs.register(new NavigationGraph("waits", edges));
        when(detector.detect("waits", true)).thenReturn(on("A"), on("B"));

        NavigationResult r = navigator.navigateTo("waits", "B", 3, true, CancellationToken.none());

        assertThat(r.getStatus()).isEqualTo(NavigationStatus.SUCCESS);
        assertThat(sleeps).startsWith(2500L);
        verify(driver, never()).execute(any());
    }

    // ── Safe-state recovery ───────────────────────────────────────────────

    @Test(description = "Recovery falls back to the next target when the preferred one has no path")
    public void testRecoveryFallback() {
        screens("X", "X", "X", "Q");

        NavigationResult r = navigator.recoverToSafeState(APP, "warmup");

        assertThat(r.getStatus()).isEqualTo(NavigationStatus.SUCCESS);
        assertThat(r.getTargetScreen()).isEqualTo("Q");
        assertThat(r.getPathSummary()).containsExactly("X → Q");
    }

    @Test(description = "After the preferred screen fails, recovery heads for the nearest remaining target")
    public void testRecoveryNearestTarget() {
        screens("A", "A", "A", "B");

        NavigationResult r = navigator.recoverToSafeState(APP, "nearest");

        assertThat(r.getStatus()).isEqualTo(NavigationStatus.SUCCESS);
        assertThat(r.getTargetScreen()).isEqualTo("B");
        assertThat(r.getPathSummary()).containsExactly("A → B");
    }

    @Test(description = "Recovery waits out an unknown screen instead of giving up on the target")
    public void testRecoveryFromUnknown() {
        screens(ScreenDetectionResult.UNKNOWN_SCREEN, ScreenDetectionResult.UNKNOWN_SCREEN, "X", "X", "Q");

        NavigationResult r = navigator.recoverToSafeState(APP, "warmup");

        assertThat(r.getStatus()).isEqualTo(NavigationStatus.SUCCESS);
        assertThat(r.getTargetScreen()).isEqualTo("Q");
    }

    @Test(description = "Recovery from a screen already in the context returns ALREADY_THERE")
    public void testRecoveryAlreadySafe() throws Exception {
        screens("Q");

        NavigationResult r = navigator.recoverToSafeState(APP, "warmup");

        assertThat(r.getStatus()).isEqualTo(NavigationStatus.ALREADY_THERE);
        assertThat(r.getFinalScreen()).isEqualTo("Q");
        verify(driver, never()).execute(any());
    }

    @Test(description = "When every target fails, the last attempt's result is returned")
    public void testRecoveryAllFail() {
        screens("C");

        NavigationResult r = navigator.recoverToSafeState(APP, "warmup");

        assertThat(r.getStatus()).isEqualTo(NavigationStatus.NO_PATH);
        assertThat(r.getTargetScreen()).isEqualTo("Q");
    }

    @Test(description = "Unknown contexts fall back to the default, then to signature safe states")
    public void testResolveSafeTargets() {
        assertThat(navigator.resolveSafeTargets(APP, "warmup")).containsExactly("P", "Q");
        assertThat(navigator.resolveSafeTargets(APP, "nope")).containsExactly("P", "Q");
        assertThat(navigator.resolveSafeTargets(APP, null)).containsExactly("P", "Q");

        graphs.register(new NavigationGraph(APP, Map.of()));
        assertThat(navigator.resolveSafeTargets(APP, "warmup")).containsExactly("C");
    }

    @Test(description = "Recovery for an app without safe states reports NO_PATH")
    public void testRecoveryWithoutSafeStates() {
        NavigationResult r = navigator.recoverToSafeState("empty_app", "warmup");

        assertThat(r.getStatus()).isEqualTo(NavigationStatus.NO_PATH);
        assertThat(r.getErrorMessage()).isEqualTo("No safe states declared for app empty_app");
        verifyNoInteractions(detector);
    }

    // ── Stats ─────────────────────────────────────────────────────────────

    @Test(description = "Stats count navigations, successes and executed steps")
    public void testStats() {
        screens("A", "B", "C", "C");

        navigator.navigateTo(APP, "C", 3, true, CancellationToken.none());
        navigator.navigateTo(APP, "A", 3, true, CancellationToken.none());

        NavigationStats s = navigator.getStats();
        assertThat(s.totalNavigations()).isEqualTo(2);
        assertThat(s.successfulNavigations()).isEqualTo(1);
        assertThat(s.successRate()).isEqualTo(0.5);
        assertThat(s.totalStepsExecuted()).isEqualTo(2);
        assertThat(s.graphSize()).isEqualTo(4);
    }
}
