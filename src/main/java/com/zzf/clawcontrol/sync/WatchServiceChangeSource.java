package com.zzf.clawcontrol.sync;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;
import java.util.stream.Stream;

import static java.nio.file.StandardWatchEventKinds.ENTRY_CREATE;
import static java.nio.file.StandardWatchEventKinds.ENTRY_DELETE;
import static java.nio.file.StandardWatchEventKinds.ENTRY_MODIFY;
import static java.nio.file.StandardWatchEventKinds.OVERFLOW;

/**
 * Recursive {@link WatchService} over the notes root. Every non-dot directory is
 * registered, including directories created after start.
 */
@Slf4j
public class WatchServiceChangeSource implements LocalChangeSource {
    private final Path root;
    private final DocumentFilter filter;
    private final Map<WatchKey, Path> keys = new ConcurrentHashMap<>();

    private volatile boolean running;
    private WatchService watchService;
    private Thread watcherThread;

    public WatchServiceChangeSource(Path root, DocumentFilter filter) {
        this.root = root;
        this.filter = filter;
    }

    @Override
    public synchronized void start(Consumer<String> onChange) throws IOException {
        if (running) {
            return;
        }
        watchService = FileSystems.getDefault().newWatchService();
        running = true;
        try {
            registerAll(root);
        } catch (IOException e) {
            close();
            throw e;
        }
        watcherThread = new Thread(() -> watchLoop(onChange), "clawcontrol-sync-watch");
        watcherThread.setDaemon(true);
        watcherThread.start();
    }

    @Override
    public synchronized void close() {
        running = false;
        if (watcherThread != null) {
            watcherThread.interrupt();
            watcherThread = null;
        }
        if (watchService != null) {
            try {
                watchService.close();
            } catch (IOException e) {
                log.debug("Error closing watch service: {}", e.toString());
            }
            watchService = null;
        }
        keys.clear();
    }

    private void watchLoop(Consumer<String> onChange) {
        WatchService service = watchService;
        while (running) {
            WatchKey key;
            try {
                key = service.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (ClosedWatchServiceException e) {
                break;
            }

            Path dir = keys.get(key);
            if (dir == null) {
                key.reset();
                continue;
            }
            for (WatchEvent<?> event : key.pollEvents()) {
                WatchEvent.Kind<?> kind = event.kind();
                if (kind == OVERFLOW) {
                    log.warn("Watch events overflowed under {}, some local changes may be missed", dir);
                    continue;
                }
                Path fullPath = dir.resolve((Path) event.context());
                String name = fullPath.getFileName().toString();
                if (filter.isHidden(name)) {
                    continue;
                }
                if (kind == ENTRY_CREATE && Files.isDirectory(fullPath, LinkOption.NOFOLLOW_LINKS)) {
                    onDirectoryCreated(fullPath, onChange);
                    continue;
                }
                emit(fullPath, onChange);
            }
            if (!key.reset()) {
                keys.remove(key);
            }
        }
    }

    private void onDirectoryCreated(Path dir, Consumer<String> onChange) {
        try {
            registerAll(dir);
        } catch (IOException e) {
            log.warn("Failed to watch new directory {}: {}", dir, e.toString());
            return;
        }
        // files moved in together with the directory produce no events of their own
        try (Stream<Path> walk = Files.walk(dir)) {
            walk.filter(p -> Files.isRegularFile(p, LinkOption.NOFOLLOW_LINKS)).forEach(p -> emit(p, onChange));
        } catch (IOException e) {
            log.debug("Failed to list new directory {}: {}", dir, e.toString());
        }
    }

    private void emit(Path fullPath, Consumer<String> onChange) {
        String relPath = DocumentFilter.normalize(root.relativize(fullPath).toString());
        if (!filter.accepts(relPath)) {
            return;
        }
        try {
            onChange.accept(relPath);
        } catch (RuntimeException e) {
            log.error("Local change callback failed for {}", relPath, e);
        }
    }

    private void registerAll(Path start) throws IOException {
        Files.walkFileTree(start, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) throws IOException {
                if (!running) {
                    return FileVisitResult.TERMINATE;
                }
                if (!dir.equals(start) && filter.isHidden(dir.getFileName().toString())) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                keys.put(dir.register(watchService, ENTRY_CREATE, ENTRY_DELETE, ENTRY_MODIFY), dir);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exc) {
                log.debug("Cannot visit {}: {}", file, exc.toString());
                return FileVisitResult.CONTINUE;
            }
        });
    }
}
