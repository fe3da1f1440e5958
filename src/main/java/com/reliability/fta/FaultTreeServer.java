package com.reliability.fta;

import com.reliability.fta.util.LoggingEvaluationListener;
import com.reliability.fta.util.PassStatisticsListener;
import com.reliability.fta.web.TreeApiServer;
import com.reliability.fta.wiring.TreeCommandBus;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Path;

/**
 * Runs an analysis behind the HTTP API.
 *
 * 1. Read {@link ServerSettings}.
 * 2. Build the analysis, loading the initial document if one is configured.
 * 3. Put a {@link TreeCommandBus} in front of it.
 * 4. Serve it with {@link TreeApiServer} until the JVM exits.
 */
public class FaultTreeServer {
    private static final Logger log = LogManager.getLogger(FaultTreeServer.class);

    public static void main(String[] args) throws Exception {
        ServerSettings settings = ServerSettings.load(args);
        log.info("Starting fault tree server with {}", settings);

        FaultTreeAnalysis analysis = new FaultTreeAnalysis();
        PassStatisticsListener statistics = analysis.enablePassStatistics();
        if (settings.isLogWarnings())
            analysis.addListener(new LoggingEvaluationListener());
        if (settings.getInitialDocument() != null) {
            analysis.load(Path.of(settings.getInitialDocument()));
            log.info("Loaded '{}' ({} nodes, mode {})", analysis.title(), analysis.store().size(), analysis.mode());
        }

        TreeCommandBus bus = new TreeCommandBus(analysis, settings.getRingBufferSize());
        TreeApiServer server = new TreeApiServer(bus, statistics, settings.getRequestTimeoutMs());
        server.start(settings.getPort());

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            server.stop();
            bus.close();
        }, "fault-tree-shutdown"));
    }
}
