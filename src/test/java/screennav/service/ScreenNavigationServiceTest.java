package screennav.service;

import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;
import screennav.device.DumpFileDeviceDriver;
import screennav.device.StaticDeviceRegistry;
import screennav.model.NavigationResult;
import screennav.model.NavigationStatus;
import screennav.model.PopupPattern;
import screennav.model.ScreenDetectionResult;
import screennav.model.ScreenSignature;
import screennav.navigator.CancellationToken;
import screennav.navigator.DeviceBusyException;
import screennav.navigator.NavigatorConfig;

import java.nio.file.Path;
import java.util.List;
import java.util.Properties;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link ScreenNavigationService} against the bundled catalogs and
 * a recorded Instagram explore-page dump.
 */
public class ScreenNavigationServiceTest {

    private static final String SERIAL = "dump-1";

    private ScreenNavigationService service;

    @BeforeMethod
    public void setUp() throws Exception {
        Path dump = Path.of(getClass().getResource("/dumps/instagram_explore.xml").toURI());
        StaticDeviceRegistry devices = new StaticDeviceRegistry();
        devices.add(new DumpFileDeviceDriver(SERIAL, dump));

        Properties props = new Properties();
        props.setProperty("service.device.lock.timeout.ms", "100");
        props.setProperty("navigator.settle.delay.ms", "0");
        service = ScreenNavigationService.create(devices, NavigatorConfig.of(props));
    }

    // ── Devices and detection ────────────────────────────────────────────

    @Test(description = "Registered devices are listed by serial")
    public void testListDevices() {
        assertThat(service.listDevices()).containsExactly(SERIAL);
    }

    @Test(description = "The explore dump is detected as explore_grid")
    public void testDetectScreen() {
        ScreenDetectionResult result = service.detectScreen(SERIAL, "instagram", true);

        assertThat(result.hasError()).isFalse();
        assertThat(result.getFullId()).isEqualTo("instagram/explore_grid");
        assertThat(result.isSafeState()).isTrue();
        assertThat(result.getCandidates()).isNotEmpty();
    }

    @Test(description = "Detection counters are kept per device")
    public void testDetectionStats() {
        service.detectScreen(SERIAL, "instagram", true);
        service.detectScreen(SERIAL, "instagram", true);

        assertThat(service.getDetectionStats(SERIAL).detectionCount()).isEqualTo(2);
    }

    @Test(description = "Unknown serials raise DeviceNotFoundException")
    public void testUnknownDevice() {
        assertThatThrownBy(() -> service.detectScreen("nope", "instagram", false))
                .isInstanceOf(DeviceNotFoundException.class)
                .hasMessageContaining("nope");
    }

    @Test(description = "A blank app id is rejected before touching the device")
    public void testBlankAppRejected() {
        assertThatThrownBy(() -> service.detectScreen(SERIAL, " ", false))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test(description = "Signature dump groups the current elements")
    public void testDumpForSignature() {
        assertThat(service.dumpForSignature(SERIAL)).isNotNull();
    }

    // ── Navigation ───────────────────────────────────────────────────────

    @Test(description = "Navigating to the current screen needs no action")
    public void testNavigateAlreadyThere() {
        NavigationResult result = service.navigateTo(SERIAL, "instagram", "explore_grid");

        assertThat(result.getStatus()).isEqualTo(NavigationStatus.ALREADY_THERE);
        assertThat(result.isSuccess()).isTrue();
        assertThat(service.getNavigationStats(SERIAL).totalNavigations()).isEqualTo(1);
    }

    @Test(description = "maxAttempts below one is rejected")
    public void testInvalidMaxAttempts() {
        assertThatThrownBy(() -> service.navigateTo(SERIAL, "instagram", "home_feed", 0, true,
                CancellationToken.none()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("maxAttempts");
    }

    @Test(description = "A missing target is rejected")
    public void testMissingTarget() {
        assertThatThrownBy(() -> service.navigateTo(SERIAL, "instagram", ""))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test(description = "Recovery from a safe state succeeds without acting")
    public void testRecoverFromSafeState() {
        NavigationResult result = service.recoverToSafeState(SERIAL, "instagram", "warmup");

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getFinalScreen()).isEqualTo("explore_grid");
    }

    @Test(description = "A second caller gets DeviceBusyException while the device is held")
    public void testDeviceBusy() throws Exception {
        CountDownLatch held    = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        Thread holder = new Thread(() -> service.session(SERIAL).withLock(1_000, () -> {
            held.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return null;
        }));
        holder.start();
        try {
            assertThat(held.await(5, TimeUnit.SECONDS)).isTrue();
            assertThatThrownBy(() -> service.detectScreen(SERIAL, "instagram", true))
                    .isInstanceOf(DeviceBusyException.class)
                    .hasMessageContaining(SERIAL);
        } finally {
            release.countDown();
            holder.join();
        }
        assertThat(service.detectScreen(SERIAL, "instagram", true).getScreenId()).isEqualTo("explore_grid");
    }

    // ── Popups ───────────────────────────────────────────────────────────

    @Test(description = "Default popup patterns find nothing on the explore page")
    public void testCheckDefaultPatterns() {
        PopupCheckResult result = service.checkPatterns(SERIAL, null);

        assertThat(result.anyVisible()).isFalse();
        assertThat(result.checked()).isGreaterThan(0);
        assertThat(result.message()).isEqualTo("No configured popups visible");
    }

    @Test(description = "Caller-supplied patterns are evaluated instead of the defaults")
    public void testCheckCustomPatterns() {
        PopupCheckResult result = service.checkPatterns(SERIAL, List.of(
                new PopupPattern("reel_tile", "contains:reel by", null),
                new PopupPattern("dialog", "text:Allow", "text:Deny")));

        assertThat(result.checked()).isEqualTo(2);
        assertThat(result.anyVisible()).isTrue();
        assertThat(result.found()).extracting(p -> p.name()).containsExactly("reel_tile");
    }

    // ── Catalog queries ──────────────────────────────────────────────────

    @Test(description = "Graph summary lists screens, safe states and contexts")
    public void testGraphSummary() {
        GraphView view = service.getNavigationGraph("instagram", null);

        assertThat(view).isInstanceOf(GraphView.Summary.class);
        GraphView.Summary summary = (GraphView.Summary) view;
        assertThat(summary.totalScreens()).isGreaterThan(0);
        assertThat(summary.allScreens()).contains("home_feed", "explore_grid");
        assertThat(summary.safeStates()).contains("explore_grid");
        assertThat(summary.contexts()).contains("warmup", "login");
    }

    @Test(description = "Edges of one screen, empty for a screen with no outgoing edges")
    public void testGraphEdges() {
        GraphView.Edges edges = (GraphView.Edges) service.getNavigationGraph("instagram", "home_feed");
        assertThat(edges.edgeCount()).isEqualTo(edges.edges().size()).isGreaterThan(0);
        assertThat(edges.edges()).extracting(GraphView.EdgeInfo::toScreen).contains("explore_grid");

        GraphView.Edges none = (GraphView.Edges) service.getNavigationGraph("instagram", "no_such_screen");
        assertThat(none.edges()).isEmpty();
    }

    @Test(description = "Screen listing and single-signature lookup")
    public void testScreenInfo() {
        ScreenInfo.Listing listing = (ScreenInfo.Listing) service.getScreenInfo("instagram", null);
        assertThat(listing.screens()).contains("explore_grid", "home_feed");
        assertThat(listing.totalCount()).isEqualTo(listing.screens().size());
        assertThat(listing.appsAvailable()).contains("instagram", "android_system");

        ScreenInfo.Detail detail = (ScreenInfo.Detail) service.getScreenInfo("instagram", "explore_grid");
        assertThat(detail.signature().getPriority()).isEqualTo(40);
    }

    @Test(description = "Unknown screens report the available ones")
    public void testScreenNotFound() {
        assertThatThrownBy(() -> service.getScreenInfo("instagram", "nope"))
                .isInstanceOfSatisfying(ScreenNotFoundException.class,
                        e -> assertThat(e.getAvailableScreens()).contains("home_feed"));
    }

    @Test(description = "Registered signatures replace the app's set and take effect on the next detection")
    public void testRegisterSignatures() {
        int count = service.registerSignatures("instagram", List.of(
                ScreenSignature.builder("instagram", "tab_bar_only")
                        .required(":id/tab_bar")
                        .build()));

        assertThat(count).isEqualTo(1);
        assertThat(service.getSignatureStore().screenIds("instagram")).containsExactly("tab_bar_only");
        assertThat(service.detectScreen(SERIAL, "instagram", false).getScreenId()).isEqualTo("tab_bar_only");
    }
}
