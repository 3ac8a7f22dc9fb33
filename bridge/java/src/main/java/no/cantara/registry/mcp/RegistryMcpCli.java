package no.cantara.registry.mcp;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.modelcontextprotocol.json.jackson.JacksonMcpJsonMapper;
import io.modelcontextprotocol.server.McpSyncServer;
import io.modelcontextprotocol.server.transport.StdioServerTransportProvider;
import no.cantara.registry.Catalog;
import no.cantara.registry.LoadResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * CLI entry point for registry-mcp.
 *
 * <pre>
 * Usage: registry-mcp [packages-dir] [--reload-interval SECONDS] [--no-warnings]
 * </pre>
 */
public class RegistryMcpCli {

    private static final Logger log = LoggerFactory.getLogger(RegistryMcpCli.class);

    public static void main(String[] args) {
        Path    packagesDir    = Path.of("packages");
        long    reloadInterval = 0;
        boolean warnOnFailures = true;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--no-warnings"     -> warnOnFailures = false;
                case "--reload-interval" -> {
                    if (i + 1 >= args.length) {
                        System.err.println("[registry-mcp] Error: --reload-interval needs a value in seconds");
                        System.exit(1);
                    }
                    reloadInterval = parseSeconds(args[++i]);
                }
                default -> {
                    if (!args[i].startsWith("-")) {
                        packagesDir = Path.of(args[i]);
                    }
                }
            }
        }

        if (!packagesDir.toFile().isDirectory()) {
            System.err.println("[registry-mcp] Error: packages directory not found at " + packagesDir);
            System.exit(1);
        }

        Catalog catalog = Catalog.fromDirectory(packagesDir);
        McpSyncServer server;
        try {
            LoadResult result = catalog.reload();
            if (warnOnFailures) {
                result.failures().forEach(f -> System.err.println("[registry-mcp] ⚠ " + f));
            }
            StdioServerTransportProvider transport =
                new StdioServerTransportProvider(new JacksonMcpJsonMapper(new ObjectMapper()));
            server = RegistryServer.createServer(catalog, transport);
        } catch (Exception e) {
            System.err.println("[registry-mcp] Startup error: " + e.getMessage());
            System.exit(1);
            return;
        }

        ScheduledExecutorService reloader = null;
        if (reloadInterval > 0) {
            reloader = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "catalog-reload");
                t.setDaemon(true);
                return t;
            });
            reloader.scheduleWithFixedDelay(() -> reload(catalog), reloadInterval, reloadInterval, TimeUnit.SECONDS);
        }

        // Block the main thread; transport handles I/O on daemon threads.
        // The process exits when stdin is closed (e.g. MCP client disconnects).
        CountDownLatch latch = new CountDownLatch(1);
        ScheduledExecutorService scheduled = reloader;
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            if (scheduled != null) {
                scheduled.shutdownNow();
            }
            server.close();
            latch.countDown();
        }));
        try {
            latch.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    // A failed periodic reload keeps serving the previous snapshot.
    static void reload(Catalog catalog) {
        try {
            LoadResult result = catalog.reload();
            result.failures().forEach(f -> log.warn("Package rejected on reload: {}", f));
        } catch (RuntimeException e) {
            log.error("Catalog reload failed: {}", e.getMessage(), e);
        }
    }

    private static long parseSeconds(String value) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            System.err.println("[registry-mcp] Error: invalid --reload-interval '" + value + "'");
            System.exit(1);
            return 0;
        }
    }
}
