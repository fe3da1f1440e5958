package com.reliability.fta;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import lombok.Data;

/**
 * Settings for {@link FaultTreeServer}, bound from JSON.
 *
 * Defaults come from the classpath resource {@value #RESOURCE}; a file path
 * given on the command line replaces it entirely.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ServerSettings {
    public static final String RESOURCE = "fault-tree-server.json";

    private int port = 7070;
    private int ringBufferSize = 1024;
    /** Document loaded at startup; null starts from the default root. */
    private String initialDocument;
    /** Log dangling links and cycle fallbacks (throttled). */
    private boolean logWarnings;
    private long requestTimeoutMs = 5000;

    /**
     * @param args Program arguments; the first, if any, is a settings file.
     * @throws IOException if the settings cannot be read or bound.
     */
    public static ServerSettings load(String[] args) throws IOException {
        ObjectMapper mapper = new ObjectMapper();
        if (args.length > 0)
            return mapper.readValue(Files.readAllBytes(Path.of(args[0])), ServerSettings.class);
        try (InputStream in = ServerSettings.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in == null)
                return new ServerSettings();
            return mapper.readValue(in, ServerSettings.class);
        }
    }
}
