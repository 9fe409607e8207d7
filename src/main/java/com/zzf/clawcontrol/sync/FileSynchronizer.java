package com.zzf.clawcontrol.sync;

import com.zzf.clawcontrol.connection.FileSyncHandler;
import com.zzf.clawcontrol.loop.EventLoop;
import com.zzf.clawcontrol.protocol.FileRecord;
import com.zzf.clawcontrol.protocol.FileSnapshotAckFrame;
import com.zzf.clawcontrol.protocol.FileSnapshotFrame;
import com.zzf.clawcontrol.protocol.FileSyncFrame;
import com.zzf.clawcontrol.protocol.FileSyncPushFrame;
import com.zzf.clawcontrol.protocol.OutboundFrame;
import com.zzf.clawcontrol.protocol.SyncAction;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.function.Consumer;

/**
 * Keeps the local notes tree and the app's copy in step.
 *
 * <p>Local changes flow through: change source, {@link Debouncer} (one evaluation per path
 * per burst), {@link EchoSuppressor} (drops notifications caused by our own writes), then
 * an upsert or delete frame handed to the injected sender. Writes requested by the app
 * mark the path suppressed before touching the filesystem.</p>
 *
 * <p>Intake, evaluation and server pushes run on the {@link EventLoop}. The synchronizer
 * never touches the socket; everything goes through {@code sender}.</p>
 */
@Slf4j
public class FileSynchronizer implements FileSyncHandler {
    public static final long DEFAULT_DEBOUNCE_MILLIS = 300L;
    public static final long DEFAULT_SUPPRESSION_WINDOW_MILLIS = 1_000L;

    private final Path root;
    private final Consumer<OutboundFrame> sender;
    private final EventLoop loop;
    private final DocumentFilter filter;
    private final DirectoryScanner scanner;
    private final LocalChangeSource changeSource;
    private final Debouncer debouncer;
    private final EchoSuppressor suppressor;

    private volatile boolean running;

    public FileSynchronizer(Path root,
                            Consumer<OutboundFrame> sender,
                            EventLoop loop,
                            DocumentFilter filter,
                            LocalChangeSource changeSource,
                            long debounceMillis,
                            long suppressionWindowMillis) {
        this.root = root.toAbsolutePath().normalize();
        this.sender = sender;
        this.loop = loop;
        this.filter = filter;
        this.scanner = new DirectoryScanner(this.root, filter);
        this.changeSource = changeSource;
        this.debouncer = new Debouncer(loop, debounceMillis);
        this.suppressor = new EchoSuppressor(loop, suppressionWindowMillis);
    }

    public Path getRoot() {
        return root;
    }

    public boolean isRunning() {
        return running;
    }

    EchoSuppressor getSuppressor() {
        return suppressor;
    }

    Debouncer getDebouncer() {
        return debouncer;
    }

    /**
     * Scan the tree, send one snapshot, then start watching. A watcher that fails to
     * start is logged; the snapshot has already gone out.
     */
    public void start() {
        if (running) {
            return;
        }
        running = true;
        sendSnapshot();
        try {
            changeSource.start(this::onLocalChange);
            log.info("[sync] watching: {}", root);
        } catch (IOException | RuntimeException e) {
            log.error("[sync] failed to start watcher for {}: {}", root, e.toString());
        }
    }

    /**
     * Re-send the snapshot, e.g. after a reconnect, so local edits dropped while the
     * connection was down reach the app.
     */
    public void resync() {
        if (!running) {
            return;
        }
        sendSnapshot();
    }

    public void stop() {
        running = false;
        changeSource.close();
        debouncer.cancelAll();
        suppressor.clear();
        log.info("[sync] stopped");
    }

    public List<FileRecord> scan() {
        return scanner.scan();
    }

    private void sendSnapshot() {
        List<FileRecord> files = scanner.scan();
        sender.accept(new FileSnapshotFrame(files));
        log.info("[sync] sent snapshot: {} files", files.size());
    }

    // ── local changes ──

    /**
     * Entry point for the change source; safe to call from any thread.
     */
    public void onLocalChange(String relativePath) {
        String relPath = DocumentFilter.normalize(relativePath);
        loop.execute(() -> intake(relPath));
    }

    private void intake(String relPath) {
        if (!running || !filter.accepts(relPath)) {
            return;
        }
        if (suppressor.isSuppressed(relPath)) {
            log.debug("[sync] ignoring echo for {}", relPath);
            return;
        }
        debouncer.submit(relPath, () -> evaluate(relPath));
    }

    private void evaluate(String relPath) {
        if (!running) {
            return;
        }
        if (suppressor.isSuppressed(relPath)) {
            log.debug("[sync] ignoring echo for {}", relPath);
            return;
        }
        Path absPath;
        try {
            absPath = resolve(relPath);
        } catch (IOException e) {
            log.warn("[sync] {}", e.getMessage());
            return;
        }
        if (Files.isRegularFile(absPath, LinkOption.NOFOLLOW_LINKS)) {
            try {
                String content = Files.readString(absPath, StandardCharsets.UTF_8);
                sender.accept(FileSyncFrame.upsert(relPath, content));
                log.info("[sync] pushed change: {}", relPath);
            } catch (NoSuchFileException e) {
                sender.accept(FileSyncFrame.delete(relPath));
                log.info("[sync] pushed delete: {}", relPath);
            } catch (IOException e) {
                log.warn("[sync] failed to read {}: {}", relPath, e.toString());
            }
        } else if (!Files.exists(absPath, LinkOption.NOFOLLOW_LINKS)) {
            sender.accept(FileSyncFrame.delete(relPath));
            log.info("[sync] pushed delete: {}", relPath);
        }
    }

    // ── changes from the app ──

    @Override
    public void handleServerPush(FileSyncPushFrame push) throws IOException {
        SyncAction action = push.getAction();
        String relPath = DocumentFilter.normalize(push.getPath());
        if (action == null) {
            log.warn("[sync] ignoring push without action for {}", relPath);
            return;
        }
        switch (action) {
            case UPSERT:
                if (push.getContent() == null) {
                    log.warn("[sync] ignoring upsert without content for {}", relPath);
                    return;
                }
                write(relPath, push.getContent());
                log.info("[sync] wrote: {}", relPath);
                break;
            case DELETE: {
                Path absPath = resolve(relPath);
                suppressor.suppress(relPath);
                if (Files.deleteIfExists(absPath)) {
                    log.info("[sync] deleted: {}", relPath);
                } else {
                    log.info("[sync] delete of missing file: {}", relPath);
                }
                break;
            }
            case RENAME: {
                String oldRelPath = DocumentFilter.normalize(push.getOldPath());
                if (oldRelPath == null || oldRelPath.isBlank()) {
                    log.warn("[sync] ignoring rename without oldPath for {}", relPath);
                    return;
                }
                Path oldAbs = resolve(oldRelPath);
                Path newAbs = resolve(relPath);
                suppressor.suppress(oldRelPath);
                suppressor.suppress(relPath);
                if (!Files.exists(oldAbs)) {
                    log.warn("[sync] rename source missing: {} -> {}", oldRelPath, relPath);
                    return;
                }
                ensureParent(newAbs);
                try {
                    Files.move(oldAbs, newAbs, StandardCopyOption.REPLACE_EXISTING);
                    log.info("[sync] renamed: {} -> {}", oldRelPath, relPath);
                } catch (NoSuchFileException e) {
                    log.warn("[sync] rename source missing: {} -> {}", oldRelPath, relPath);
                }
                break;
            }
            default:
                log.warn("[sync] unsupported action {} for {}", action, relPath);
        }
    }

    /**
     * Materialize documents the app holds but the snapshot lacked. Only upserts apply.
     */
    @Override
    public void handleSnapshotAck(FileSnapshotAckFrame ack) throws IOException {
        if (ack.getUpdates() == null) {
            return;
        }
        for (FileSnapshotAckFrame.Update update : ack.getUpdates()) {
            if (update.getAction() != SyncAction.UPSERT || update.getContent() == null) {
                continue;
            }
            String relPath = DocumentFilter.normalize(update.getPath());
            write(relPath, update.getContent());
            log.info("[sync] wrote server-only file: {}", relPath);
        }
    }

    private void write(String relPath, String content) throws IOException {
        Path absPath = resolve(relPath);
        ensureParent(absPath);
        suppressor.suppress(relPath);
        Files.writeString(absPath, content, StandardCharsets.UTF_8);
    }

    private void ensureParent(Path absPath) throws IOException {
        Path parent = absPath.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }

    private Path resolve(String relPath) throws IOException {
        if (relPath == null || relPath.isBlank()) {
            throw new IOException("Sync path is empty");
        }
        Path target = root.resolve(relPath).normalize();
        if (!target.startsWith(root) || target.equals(root)) {
            throw new IOException("Sync path escapes notes root: " + relPath);
        }
        return target;
    }
}
