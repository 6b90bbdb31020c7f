package com.chartsnap.core.io;

import com.chartsnap.core.exception.RequestUnreadableException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * The capture request marker file. Its existence is the request; its content is informational only.
 */
public class RequestMarker {

    private final Path path;

    public RequestMarker(Path path) {
        this.path = path;
    }

    public Path getPath() {
        return path;
    }

    public boolean isPresent() {
        return Files.exists(path);
    }

    /**
     * Read the marker content.
     *
     * @throws RequestUnreadableException if the marker cannot be opened or read
     */
    public String read() throws RequestUnreadableException {
        try {
            return HostText.read(path).trim();
        } catch (IOException e) {
            throw new RequestUnreadableException("Cannot read request marker " + path + ": " + e.getMessage(), e);
        }
    }

    /**
     * Delete the marker.
     *
     * @throws IOException if the marker exists but cannot be deleted
     */
    public void consume() throws IOException {
        Files.deleteIfExists(path);
    }
}
