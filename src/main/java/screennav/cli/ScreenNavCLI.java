package screennav.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import screennav.device.DumpFileDeviceDriver;
import screennav.device.StaticDeviceRegistry;
import screennav.graph.NavigationGraph;
import screennav.graph.Pathfinder;
import screennav.model.CatalogIO;
import screennav.model.NavigationPath;
import screennav.model.NavigationStep;
import screennav.model.ScreenDetectionResult;
import screennav.navigator.NavigatorConfig;
import screennav.server.APIServer;
import screennav.service.ScreenNavigationService;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;

/**
 * Unified CLI entry-point for ScreenNav.
 *
 * <p>Sub-commands:
 * <ul>
 *   <li>{@code screennav screens}  print the screens of an app, or one signature</li>
 *   <li>{@code screennav graph}    print the navigation graph summary or a screen's edges</li>
 *   <li>{@code screennav path}     plan a path between two screens offline</li>
 *   <li>{@code screennav detect}   detect the screen in a saved hierarchy dump</li>
 *   <li>{@code screennav serve}    start the HTTP API</li>
 *   <li>{@code screennav version}  print build version</li>
 * </ul>
 *
 * <p>Every command loads the catalogs listed in {@code screennav.properties}.
 */
@Command(
        name        = "screennav",
        description = "Signature-based screen detection and graph navigation for mobile apps",
        version     = "1.0.0-SNAPSHOT",
        mixinStandardHelpOptions = true,
        subcommands = {
                ScreenNavCLI.ScreensCommand.class,
                ScreenNavCLI.GraphCommand.class,
                ScreenNavCLI.PathCommand.class,
                ScreenNavCLI.DetectCommand.class,
                ScreenNavCLI.ServeCommand.class,
                ScreenNavCLI.VersionCommand.class
        }
)
public class ScreenNavCLI implements Callable<Integer> {

    @Override
    public Integer call() {
        CommandLine.usage(this, System.out);
        return 0;
    }

    // ── Entry-point ─────────────────────────────────────────────────────────

    public static void main(String[] args) {
        int exit = new CommandLine(new ScreenNavCLI()).execute(args);
        System.exit(exit);
    }

    /** Service with the configured catalogs and no live devices. */
    static ScreenNavigationService offlineService() {
        return ScreenNavigationService.create(new StaticDeviceRegistry(), new NavigatorConfig());
    }

    // ── Catalog queries ──────────────────────────────────────────────────────

    @Command(
            name        = "screens",
            description = "List the screens registered for an app, or print one signature",
            mixinStandardHelpOptions = true
    )
    static class ScreensCommand implements Callable<Integer> {

        @Parameters(index = "0", description = "App id, e.g. instagram")
        String appId;

        @Option(names = {"-s", "--screen"}, description = "Print the signature of this screen only")
        String screen;

        @Override
        public Integer call() throws Exception {
            ScreenNavigationService service = offlineService();
            if (!service.getSignatureStore().hasApp(appId)) {
                System.err.println("Unknown app: " + appId
                        + " (available: " + service.getSignatureStore().appIds() + ")");
                return 1;
            }
            System.out.println(CatalogIO.toJson(service.getScreenInfo(appId, screen)));
            return 0;
        }
    }

    @Command(
            name        = "graph",
            description = "Print an app's navigation graph, or the edges out of one screen",
            mixinStandardHelpOptions = true
    )
    static class GraphCommand implements Callable<Integer> {

        @Parameters(index = "0", description = "App id, e.g. instagram")
        String appId;

        @Option(names = {"-f", "--from"}, description = "Only print edges leaving this screen")
        String from;

        @Override
        public Integer call() throws Exception {
            ScreenNavigationService service = offlineService();
            System.out.println(CatalogIO.toJson(service.getNavigationGraph(appId, from)));
            return 0;
        }
    }

    @Command(
            name        = "path",
            description = "Plan the fewest-edge path between two screens (no device needed)",
            mixinStandardHelpOptions = true
    )
    static class PathCommand implements Callable<Integer> {

        @Parameters(index = "0", description = "App id")
        String appId;

        @Parameters(index = "1", description = "Start screen")
        String from;

        @Parameters(index = "2", description = "Target screen")
        String to;

        @Override
        public Integer call() {
            NavigationGraph graph = offlineService().getGraphRegistry().getOrEmpty(appId);
            Optional<NavigationPath> path = Pathfinder.findPath(graph, from, to);
            if (path.isEmpty()) {
                System.err.printf("No path from %s to %s in %s%n", from, to, appId);
                return 2;
            }
            NavigationPath p = path.get();
            if (p.isEmpty()) {
                System.out.println("Already at " + to);
                return 0;
            }
            System.out.printf("Path %s -> %s (%d steps, cost %.1f, reliability %.3f)%n",
                    from, to, p.size(), p.getTotalCost(), p.getEstimatedReliability());
            int i = 1;
            for (NavigationStep step : p.getSteps()) {
                System.out.printf("  %d. %s  %s%n", i++, step.summary(), step.edge().getDescription());
            }
            return 0;
        }
    }

    // ── Detection ────────────────────────────────────────────────────────────

    /**
     * Detects the screen captured in a uiautomator XML (or UiNode JSON) dump.
     *
     * <pre>
     *   screennav detect instagram --dump window_dump.xml
     * </pre>
     */
    @Command(
            name        = "detect",
            description = "Detect the screen in a saved UI hierarchy dump",
            mixinStandardHelpOptions = true
    )
    static class DetectCommand implements Callable<Integer> {

        private static final Logger log = LoggerFactory.getLogger(DetectCommand.class);

        private static final String DUMP_SERIAL = "dump";

        @Parameters(index = "0", description = "App id, e.g. instagram")
        String appId;

        @Option(names = {"-d", "--dump"}, required = true,
                description = "Path to a uiautomator .xml dump or a UiNode .json file")
        Path dumpFile;

        @Override
        public Integer call() throws Exception {
            if (!Files.exists(dumpFile)) {
                System.err.println("Dump file not found: " + dumpFile.toAbsolutePath());
                return 1;
            }
            StaticDeviceRegistry devices = new StaticDeviceRegistry();
            devices.add(new DumpFileDeviceDriver(DUMP_SERIAL, dumpFile));
            ScreenNavigationService service = ScreenNavigationService.create(devices, new NavigatorConfig());

            log.debug("Detecting {} screen from {}", appId, dumpFile);
            ScreenDetectionResult result = service.detectScreen(DUMP_SERIAL, appId, true);
            System.out.println(CatalogIO.toJson(result));
            if (result.hasError()) {
                System.err.println("Detection failed: " + result.getError());
                return 2;
            }
            return result.isUnknown() ? 3 : 0;
        }
    }

    // ── Server ───────────────────────────────────────────────────────────────

    @Command(
            name        = "serve",
            description = "Start the HTTP API on localhost",
            mixinStandardHelpOptions = true
    )
    static class ServeCommand implements Callable<Integer> {

        @Option(names = {"-p", "--port"}, description = "Port (default: server.port from screennav.properties)")
        Integer port;

        @Override
        public Integer call() throws Exception {
            ScreenNavigationService service = offlineService();
            int p = port != null ? port : service.getConfig().getServerPort();
            APIServer server = new APIServer(p, service);
            server.start();
            System.out.printf("ScreenNav API on http://localhost:%d (Ctrl+C to stop)%n", server.getPort());

            CountDownLatch shutdown = new CountDownLatch(1);
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                server.stop();
                shutdown.countDown();
            }));
            shutdown.await();
            return 0;
        }
    }

    // ── Version ───────────────────────────────────────────────────────────────

    @Command(
            name        = "version",
            description = "Print ScreenNav version",
            mixinStandardHelpOptions = true
    )
    static class VersionCommand implements Callable<Integer> {

        @Override
        public Integer call() {
            System.out.println("ScreenNav 1.0.0-SNAPSHOT");
            System.out.println("Modules: detect, signature, graph, navigator, service, server, cli");
            return 0;
        }
    }
}
