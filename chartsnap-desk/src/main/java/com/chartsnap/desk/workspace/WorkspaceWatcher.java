package com.chartsnap.desk.workspace;

import com.chartsnap.core.watch.FileChangeWatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Watches the workspace file and triggers a reload when it is written.
 * A deleted workspace keeps the current charts.
 */
public class WorkspaceWatcher {

    private static final Logger log = LoggerFactory.getLogger(WorkspaceWatcher.class);

    private final Path workspaceFile;
    private final FileChangeWatcher fileWatcher;

    public WorkspaceWatcher(Path workspaceFile, Runnable onChanged) {
        this.workspaceFile = workspaceFile;
        this.fileWatcher = new FileChangeWatcher(workspaceFile, "WorkspaceWatcher", path -> {
            log.info("Workspace {} changed, reloading", path.getFileName());
            onChanged.run();
        });
    }

    /**
     * Start watching for changes.
     */
    public void start() {
        if (fileWatcher.isRunning()) {
            return;
        }
        try {
            fileWatcher.start();
            log.info("Started watching {}", workspaceFile);
        } catch (IOException e) {
            log.error("Failed to start workspace watcher: {}", e.getMessage());
        }
    }

    public void stop() {
        fileWatcher.stop();
    }

    public boolean isRunning() {
        return fileWatcher.isRunning();
    }
}
