package io.snapbridge.cli;

import io.snapbridge.config.SnapBridgeConfig;
import io.snapbridge.model.DataKind;
import io.snapbridge.runtime.SnapBridgeRuntime;
import io.snapbridge.web.SnapApiServer;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(
        name = "snapbridge",
        mixinStandardHelpOptions = true,
        description = "Diagnostic broker for connected browser agents",
        subcommands = {
                SnapBridgeCommand.ServeCommand.class,
                SnapBridgeCommand.SessionsCommand.class,
                SnapBridgeCommand.DumpCommand.class,
                SnapBridgeCommand.HtmlCommand.class,
                SnapBridgeCommand.ConsoleCommand.class,
                SnapBridgeCommand.NetworkCommand.class,
                SnapBridgeCommand.ScreenshotCommand.class,
                SnapBridgeCommand.PingCommand.class,
                SnapBridgeCommand.MetricsCommand.class
        }
)
public final class SnapBridgeCommand implements Runnable {
    @Option(names = {"--url"}, description = "Base URL of a running broker", defaultValue = "http://127.0.0.1:5178/__snap")
    String url;

    @Override
    public void run() {
        System.out.println("Use subcommands: serve | sessions | dump | html | console | network | screenshot | ping | metrics");
    }

    SnapApiClient client() {
        return new SnapApiClient(url);
    }

    static int print(SnapApiClient.Response response) {
        System.out.println(response.text());
        return response.ok() ? 0 : 1;
    }

    @Command(name = "serve", description = "Run the broker (HTTP routes and agent channels) until interrupted")
    static final class ServeCommand implements Callable<Integer> {
        @Option(names = {"--settings"}, description = "JSON settings file", defaultValue = SnapBridgeConfig.DEFAULT_SETTINGS_FILE)
        String settings;

        @Option(names = {"--bind"}, description = "Bind host")
        String bind;

        @Option(names = {"--port"}, description = "Bind port")
        Integer port;

        @Option(names = {"--base-path"}, description = "Route prefix (default /__snap)")
        String basePath;

        @Option(names = {"--active-window-ms"}, description = "Window for active-only session listings")
        Long activeWindowMs;

        @Option(names = {"--heartbeat-interval-ms"}, description = "Heartbeat interval advertised to agents")
        Long heartbeatIntervalMs;

        @Option(names = {"--sweep-interval-ms"}, description = "Stale-session sweep interval")
        Long sweepIntervalMs;

        @Option(names = {"--stale-after-ms"}, description = "Evict sessions without heartbeat for this long")
        Long staleAfterMs;

        @Option(names = {"--dump-wait-ms"}, description = "Default wait budget for dumps")
        Long dumpWaitMs;

        @Option(names = {"--ping-wait-ms"}, description = "Default wait budget for pings")
        Long pingWaitMs;

        @Option(names = {"--max-wait-ms"}, description = "Upper bound for any caller wait budget")
        Long maxWaitMs;

        @Option(names = {"--keep-alive-ms"}, description = "Keep-alive interval on agent channels")
        Long keepAliveMs;

        @Override
        public Integer call() throws Exception {
            SnapBridgeConfig config = SnapBridgeConfig.load(settings).merge(new SnapBridgeConfig.SettingsFile(
                    bind,
                    port,
                    basePath,
                    activeWindowMs,
                    heartbeatIntervalMs,
                    sweepIntervalMs,
                    staleAfterMs,
                    dumpWaitMs,
                    pingWaitMs,
                    maxWaitMs,
                    keepAliveMs
            ));
            SnapBridgeRuntime runtime = new SnapBridgeRuntime(config);
            SnapApiServer server = new SnapApiServer(runtime, new InetSocketAddress(config.bind(), config.port()));
            Runtime.getRuntime().addShutdownHook(new Thread(server::stop, "snapbridge-shutdown"));
            server.start();
            System.out.println("Snap API listening on " + server.baseUrl()
                    + ", activeWindowMs=" + config.activeWindowMs()
                    + ", staleAfterMs=" + config.staleAfterMs()
                    + ", sweepIntervalMs=" + config.sweepIntervalMs());
            Thread.currentThread().join();
            return 0;
        }
    }

    @Command(name = "sessions", description = "List known agent sessions")
    static final class SessionsCommand implements Callable<Integer> {
        @ParentCommand
        SnapBridgeCommand parent;

        @Option(names = {"--active"}, defaultValue = "false", description = "Only sessions with a recent heartbeat")
        boolean active;

        @Option(names = {"--active-ms"}, description = "Activity window in milliseconds (implies --active)")
        Long activeMs;

        @Override
        public Integer call() throws Exception {
            Map<String, String> query = new LinkedHashMap<>();
            if (active) {
                query.put("active", "1");
            }
            if (activeMs != null) {
                query.put("activeMs", String.valueOf(activeMs));
            }
            return print(parent.client().get("/sessions", query, 0L));
        }
    }

    @Command(name = "dump", description = "Request a diagnostic dump from one session")
    static final class DumpCommand implements Callable<Integer> {
        @ParentCommand
        SnapBridgeCommand parent;

        @Option(names = {"--sid"}, required = true, description = "Target session id (browserId:pageId)")
        String sid;

        @Option(names = {"--types"}, defaultValue = "all",
                description = "Comma-separated kinds: html, console, network, perf, screenshotDom (default all)")
        String types;

        @Option(names = {"--wait-ms"}, defaultValue = "5000", description = "Wait budget in milliseconds")
        long waitMs;

        @Override
        public Integer call() throws Exception {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("sid", sid);
            body.put("types", DataKind.wireNames(DataKind.parseCsv(types)));
            body.put("waitMs", waitMs);
            return print(parent.client().postJson("/dump", body, waitMs));
        }
    }

    @Command(name = "html", description = "Fetch the page HTML of one session")
    static final class HtmlCommand implements Callable<Integer> {
        @ParentCommand
        SnapBridgeCommand parent;

        @Option(names = {"--sid"}, required = true, description = "Target session id")
        String sid;

        @Override
        public Integer call() throws Exception {
            return print(parent.client().get("/html", Map.of("sid", sid), SnapBridgeConfig.DEFAULT_DUMP_WAIT_MS));
        }
    }

    @Command(name = "console", description = "Fetch captured console records of one session")
    static final class ConsoleCommand implements Callable<Integer> {
        @ParentCommand
        SnapBridgeCommand parent;

        @Option(names = {"--sid"}, required = true, description = "Target session id")
        String sid;

        @Override
        public Integer call() throws Exception {
            return print(parent.client().get("/console", Map.of("sid", sid), SnapBridgeConfig.DEFAULT_DUMP_WAIT_MS));
        }
    }

    @Command(name = "network", description = "Fetch network and performance records of one session")
    static final class NetworkCommand implements Callable<Integer> {
        @ParentCommand
        SnapBridgeCommand parent;

        @Option(names = {"--sid"}, required = true, description = "Target session id")
        String sid;

        @Override
        public Integer call() throws Exception {
            return print(parent.client().get("/network", Map.of("sid", sid), SnapBridgeConfig.DEFAULT_DUMP_WAIT_MS));
        }
    }

    @Command(name = "screenshot", description = "Save a DOM screenshot of one session")
    static final class ScreenshotCommand implements Callable<Integer> {
        @ParentCommand
        SnapBridgeCommand parent;

        @Option(names = {"--sid"}, required = true, description = "Target session id")
        String sid;

        @Option(names = {"--out"}, required = true, description = "Output image file")
        String out;

        @Override
        public Integer call() throws Exception {
            SnapApiClient.Response response = parent.client().get("/screenshot", Map.of("sid", sid), SnapBridgeConfig.DEFAULT_DUMP_WAIT_MS);
            if (!response.ok()) {
                return print(response);
            }
            Path target = Paths.get(out).toAbsolutePath().normalize();
            try {
                if (target.getParent() != null) {
                    Files.createDirectories(target.getParent());
                }
                Files.write(target, response.body());
            } catch (IOException e) {
                throw new RuntimeException("Failed to write screenshot: " + target, e);
            }
            System.out.println("Saved " + response.body().length + " bytes (" + response.contentType() + ") to " + target);
            return 0;
        }
    }

    @Command(name = "ping", description = "Check that one session answers and measure round-trip time")
    static final class PingCommand implements Callable<Integer> {
        @ParentCommand
        SnapBridgeCommand parent;

        @Option(names = {"--sid"}, required = true, description = "Target session id")
        String sid;

        @Option(names = {"--wait-ms"}, defaultValue = "3000", description = "Wait budget in milliseconds")
        long waitMs;

        @Override
        public Integer call() throws Exception {
            return print(parent.client().get("/ping", Map.of("sid", sid, "waitMs", String.valueOf(waitMs)), waitMs));
        }
    }

    @Command(name = "metrics", description = "Print broker metrics in Prometheus text format")
    static final class MetricsCommand implements Callable<Integer> {
        @ParentCommand
        SnapBridgeCommand parent;

        @Override
        public Integer call() throws Exception {
            return print(parent.client().get("/metrics", Map.of(), 0L));
        }
    }
}
