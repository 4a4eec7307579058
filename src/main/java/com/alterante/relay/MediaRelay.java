package com.alterante.relay;

import com.alterante.relay.device.MediaFile;
import com.alterante.relay.device.MediaSource;
import com.alterante.relay.http.ConnectionState;
import com.alterante.relay.http.HttpProtocolException;
import com.alterante.relay.queue.CommandQueue;
import com.alterante.relay.queue.ErrorReporter;
import com.alterante.relay.queue.EventLoop;
import com.alterante.relay.queue.LoggingErrorReporter;
import com.alterante.relay.queue.UserError;
import com.alterante.relay.server.FetchOutputFile;
import com.alterante.relay.server.FetchRemoteFiles;
import com.alterante.relay.server.ServerSession;
import com.alterante.relay.storage.LocalMediaStore;
import com.alterante.relay.transfer.DownloadCoordinator;
import com.alterante.relay.transfer.PauseReason;
import com.alterante.relay.transfer.SpeedSampler;
import com.alterante.relay.transfer.TransferSnapshot;
import com.alterante.relay.transfer.UploadCoordinator;
import com.alterante.relay.transfer.UploadItem;
import com.alterante.relay.transfer.UploadTarget;
import com.alterante.relay.transfer.WaitingFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.function.Consumer;
import java.util.function.LongConsumer;

/**
 * Wires the relay together: one event loop, a command queue and an I/O thread per leg,
 * both transfer coordinators and, when configured, the server session.
 */
public class MediaRelay implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MediaRelay.class);

    private static final UploadTarget NO_SERVER = (name, file, onBytesSent, cancelled) -> {
        throw new HttpProtocolException("No processing server configured");
    };

    private final MediaSource source;
    private final LocalMediaStore store;
    private final ErrorReporter reporter;
    private final EventLoop loop;
    private final CommandQueue deviceQueue;
    private final CommandQueue serverQueue;
    private final ExecutorService downloadIo;
    private final ExecutorService uploadIo;
    private final ServerSession session;
    private final DownloadCoordinator download;
    private final UploadCoordinator upload;
    private final SpeedSampler sampler;

    /** User errors go to the log. */
    public MediaRelay(RelayConfig config, MediaSource source, LocalMediaStore store) {
        this(config, source, store, new LoggingErrorReporter());
    }

    public MediaRelay(RelayConfig config, MediaSource source, LocalMediaStore store, ErrorReporter reporter) {
        this(config, source, store, reporter, null);
    }

    /**
     * @param source the device, or null when the relay only talks to the server
     * @param target where uploads go; when null, a {@link ServerSession} for
     *               {@link RelayConfig#server()} is created (if configured)
     */
    public MediaRelay(RelayConfig config, MediaSource source, LocalMediaStore store, ErrorReporter reporter,
                      UploadTarget target) {
        this.source = source;
        this.store = store;
        this.reporter = reporter;
        this.loop = new EventLoop("relay-loop");
        this.deviceQueue = new CommandQueue("device", loop, reporter, config.maxRetries(), config.retryDelayMs());
        this.serverQueue = new CommandQueue("server", loop, reporter, config.maxRetries(), config.retryDelayMs());
        this.downloadIo = Executors.newSingleThreadExecutor(named("download-io"));
        this.uploadIo = Executors.newSingleThreadExecutor(named("upload-io"));

        UploadTarget uploadTarget = target;
        if (uploadTarget == null && config.server() != null) {
            RelayConfig.Server s = config.server();
            session = new ServerSession(s.host(), s.port(), s.token(), s.sessionId(),
                    config.connectTimeoutMs(), config.keepAlive(), serverQueue);
            session.addStateListener(this::onServerState);
            uploadTarget = session;
        } else {
            session = null;
        }
        if (uploadTarget == null) {
            uploadTarget = NO_SERVER;
        }

        this.download = new DownloadCoordinator(loop, deviceQueue, source, store, downloadIo, reporter);
        this.upload = new UploadCoordinator(loop, serverQueue, uploadTarget, store, uploadIo, reporter);
        download.linkUploadLeg(upload);
        upload.linkDownloadLeg(download);

        this.sampler = new SpeedSampler(loop, List.of(download, upload));
        sampler.start();

        if (source != null && source.isAvailable()) {
            download.deviceConnected();
        }
        // A session opens the server queue on CONNECTED; any other target is always reachable
        if (session == null) {
            serverQueue.setEnabled(true);
        }
    }

    // --- connections ---

    /**
     * Connect and authorize with the processing server, then refresh the list of files it
     * already holds.
     */
    public void connectServer() throws IOException {
        if (session == null) {
            throw new IllegalStateException("No processing server configured");
        }
        session.connect();
        serverQueue.push(new FetchRemoteFiles(session, upload, loop, uploadIo));
    }

    public void addServerStateListener(Consumer<ConnectionState> listener) {
        if (session != null) {
            session.addStateListener(listener);
        }
    }

    public void disconnectServer() {
        if (session != null) {
            session.disconnect();
        }
    }

    /** For upload targets without a session: mark the server as reachable or not. */
    public void setServerAvailable(boolean available) {
        upload.connectionChanged(available);
        serverQueue.setEnabled(available);
    }

    public void deviceConnected() {
        download.deviceConnected();
    }

    public void deviceDisconnected() {
        download.deviceDisconnected();
    }

    private void onServerState(ConnectionState state) {
        switch (state) {
            case CONNECTED -> upload.connectionChanged(true);
            case LOST -> upload.connectionChanged(false);
            case DISCONNECTED -> upload.sessionClosed();
            default -> { }
        }
    }

    // --- transfers ---

    public List<MediaFile> listMedia() throws IOException {
        return requireDevice().listMedia();
    }

    /** Save device files to the album. */
    public void download(Collection<MediaFile> files) {
        requireDevice();
        download.requestDownload(files, false);
    }

    /**
     * Send device files to the server. Files already saved go straight to the upload set;
     * the others are downloaded to temporary copies first and uploaded as they arrive.
     */
    public void uploadFromDevice(Collection<MediaFile> files) {
        requireDevice();
        List<MediaFile> request = List.copyOf(files);
        loop.dispatch(() -> {
            List<UploadItem> local = new ArrayList<>();
            List<WaitingFile> waiting = new ArrayList<>();
            List<MediaFile> fetch = new ArrayList<>();
            int skipped = 0;

            for (MediaFile f : request) {
                String name = f.name();
                if (!f.valid() || upload.isTracked(name) || upload.isRemote(name)) {
                    skipped++;
                } else if (store.isSaved(name)) {
                    local.add(new UploadItem(name, store.finalPath(name), f.size(), false));
                } else {
                    waiting.add(new WaitingFile(name, f.size()));
                    if (!download.isPending(name)) {
                        fetch.add(f);
                    }
                }
            }
            log.info("Relaying {} files: {} local, {} from device, {} skipped",
                    request.size(), local.size(), waiting.size(), skipped);

            upload.requestUpload(local, waiting, true);
            if (!fetch.isEmpty()) {
                download.requestDownload(fetch, true);
            }
            if (skipped > 0) {
                reporter.report(new UserError("Files skipped",
                        skipped + (skipped == 1 ? " file was" : " files were")
                                + " skipped: invalid, already uploading or already on the server"));
            }
        });
    }

    /** Send local files to the server. */
    public void uploadLocal(Collection<Path> files) throws IOException {
        List<UploadItem> items = new ArrayList<>();
        for (Path p : files) {
            items.add(UploadItem.of(p, Files.size(p)));
        }
        upload.requestUpload(items, List.of(), true);
    }

    /**
     * Remove files from the device, typically once they are safely in the album. Files still
     * in the download set leave it first, along with the uploads waiting on them.
     */
    public void deleteFromDevice(Collection<MediaFile> files) throws IOException {
        MediaSource device = requireDevice();
        download.cancel(files);
        // Applied before the files go
        loop.run(() -> { });
        device.delete(files);
    }

    /** Refresh the list of files the server holds. */
    public void refreshRemoteFiles() {
        if (session == null) {
            throw new IllegalStateException("No processing server configured");
        }
        serverQueue.pushOnce(new FetchRemoteFiles(session, upload, loop, uploadIo));
    }

    /**
     * Fetch a processing output. The future completes when the file is saved, or fails
     * with the user error when the fetch is given up.
     */
    public CompletableFuture<Path> fetchOutput(String name, Path destination, LongConsumer onBytesReceived) {
        if (session == null) {
            throw new IllegalStateException("No processing server configured");
        }
        CompletableFuture<Path> result = new CompletableFuture<>();
        serverQueue.push(new FetchOutputFile(session, name, destination, uploadIo, onBytesReceived,
                result::complete, error -> result.completeExceptionally(new IOException(error.toString()))));
        return result;
    }

    // --- state ---

    public DownloadCoordinator downloadLeg() { return download; }
    public UploadCoordinator uploadLeg() { return upload; }
    public CommandQueue deviceQueue() { return deviceQueue; }
    public CommandQueue serverQueue() { return serverQueue; }
    public EventLoop loop() { return loop; }

    public MediaSource source() { return source; }
    public LocalMediaStore store() { return store; }

    public TransferSnapshot downloadSnapshot() {
        return download.snapshot();
    }

    public TransferSnapshot uploadSnapshot() {
        return upload.snapshot();
    }

    /** Retries scheduled by both queues. */
    public long totalRetries() {
        return deviceQueue.totalRetries() + serverQueue.totalRetries();
    }

    /**
     * Wait until neither leg can make progress without user action: each leg is idle or
     * stopped by a failure, and the upload leg is not waiting on an active download.
     *
     * @return false on timeout
     */
    public boolean awaitIdle(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            // Requests posted before this call are applied first
            boolean settled = loop.call(this::settled);
            if (settled) return true;
            if (System.nanoTime() >= deadline) return false;
            Thread.sleep(50);
        }
    }

    private boolean settled() {
        TransferSnapshot d = download.snapshot();
        TransferSnapshot u = upload.snapshot();
        boolean downloadDone = !d.active() || d.pausedReason() == PauseReason.FAILURE;
        boolean uploadDone = !u.active()
                || (u.pausedReason() == PauseReason.DEPENDENCY && downloadDone);
        return downloadDone && uploadDone;
    }

    @Override
    public void close() {
        sampler.close();
        if (session != null) {
            session.close();
        }
        downloadIo.shutdownNow();
        uploadIo.shutdownNow();
        loop.close();
    }

    private MediaSource requireDevice() {
        if (source == null) {
            throw new IllegalStateException("No device configured");
        }
        return source;
    }

    private static ThreadFactory named(String name) {
        return r -> {
            Thread t = new Thread(r, name);
            t.setDaemon(true);
            return t;
        };
    }
}
