package com.chartsnap.core.watch;

import io.methvin.watcher.DirectoryChangeEvent;
import io.methvin.watcher.DirectoryWatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Consumer;

/**
 * Watches the directory of one file and reports when that file is created or written.
 *
 * <p>Events for other files in the directory are ignored. A deleted file is not
 * reported. The callback runs on the watcher's daemon thread.</p>
 */
public class FileChangeWatcher {

    private static final Logger log = LoggerFactory.getLogger(FileChangeWatcher.class);

    private final Path file;
    private final String threadName;
    private final Consumer<Path> onWritten;

    private DirectoryWatcher watcher;
    private volatile boolean running = false;

    public FileChangeWatcher(Path file, String threadName, Consumer<Path> onWritten) {
        this.file = file;
        this.threadName = threadName;
        this.onWritten = onWritten;
    }

    /**
     * Start watching, creating the parent directory if needed.
     *
     * @throws IOException if the directory cannot be created or watched
     */
    public void start() throws IOException {
        if (running) {
            return;
        }
        Path dir = file.toAbsolutePath().getParent();
        Files.createDirectories(dir);

        watcher = DirectoryWatcher.builder()
            .path(dir)
            .listener(this::onEvent)
            .build();
        running = true;

        Thread watchThread = new Thread(() -> {
            try {
                watcher.watch();
            } catch (Exception e) {
                if (running) {
                    log.error("{} error: {}", threadName, e.getMessage());
                }
            }
        }, threadName);
        watchThread.setDaemon(true);
        watchThread.start();
    }

    public void stop() {
        running = false;
        if (watcher != null) {
            try {
                watcher.close();
            } catch (IOException e) {
                log.debug("Error closing {}: {}", threadName, e.getMessage());
            }
            watcher = null;
        }
    }

    void onEvent(DirectoryChangeEvent event) {
        if (!isWriteOf(event.eventType(), event.path())) {
            return;
        }
        onWritten.accept(event.path());
    }

    boolean isWriteOf(DirectoryChangeEvent.EventType type, Path path) {
        if (path == null || path.getFileName() == null || !path.getFileName().equals(file.getFileName())) {
            return false;
        }
        return type == DirectoryChangeEvent.EventType.CREATE || type == DirectoryChangeEvent.EventType.MODIFY;
    }

    public Path getFile() {
        return file;
    }

    public boolean isRunning() {
        return running;
    }
}
