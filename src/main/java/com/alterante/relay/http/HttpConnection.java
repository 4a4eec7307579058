package com.alterante.relay.http;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;
import java.util.function.LongConsumer;

/**
 * HTTP/1.1 over one long-lived TCP connection.
 *
 * Calls are serialized: one request/response exchange at a time. Any I/O failure while
 * connected moves the connection to {@link ConnectionState#LOST} and starts a background
 * reconnect to the same endpoint (500 ms × attempt, capped at 5 s) until it succeeds or
 * {@link #terminate terminate(false)} is called. The failure is still rethrown to the caller.
 */
public class HttpConnection implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(HttpConnection.class);

    public static final int CHUNK_SIZE = 64 * 1024;
    private static final int MAX_HEAD_SIZE = 64 * 1024;
    private static final long RECONNECT_STEP_MS = 500;
    private static final long RECONNECT_MAX_MS = 5000;

    private record Link(Socket socket, InputStream in, OutputStream out) {}

    private final String host;
    private final int port;
    private final int timeoutMs;
    private final boolean keepAlive;

    private final Object ioLock = new Object();
    private final List<ConnectionStateObserver> observers = new CopyOnWriteArrayList<>();
    private final ScheduledExecutorService reconnector;

    // Guarded by this
    private volatile Link link;
    private volatile ConnectionState state = ConnectionState.STARTED;
    private boolean restartAllowed = true;
    private int reconnectAttempt;
    private ScheduledFuture<?> pendingReconnect;

    private volatile AtomicBoolean sendCancel = new AtomicBoolean();
    private volatile AtomicBoolean downloadCancel = new AtomicBoolean();

    private HttpConnection(String host, int port, int timeoutMs, boolean keepAlive) {
        this.host = host;
        this.port = port;
        this.timeoutMs = timeoutMs;
        this.keepAlive = keepAlive;
        this.reconnector = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "http-reconnect");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Connect to {@code host:port}. Blocks until connected.
     *
     * @throws IOException if the connection cannot be established within the timeout
     */
    public static HttpConnection open(String host, int port, int timeoutMs, boolean keepAlive) throws IOException {
        HttpConnection connection = new HttpConnection(host, port, timeoutMs, keepAlive);
        try {
            connection.link = connection.dial();
        } catch (IOException e) {
            connection.reconnector.shutdownNow();
            throw e;
        }
        log.info("Connected to {}:{}", host, port);
        connection.setState(ConnectionState.CONNECTED);
        return connection;
    }

    /**
     * Send a request and read the complete response.
     *
     * @return raw response bytes: head, terminator and body
     */
    public byte[] send(HttpRequest request) throws IOException {
        synchronized (ioLock) {
            Link l = requireConnected();
            try {
                byte[] body = request.body();
                l.out().write(HttpCodec.encodeHead(request, hostHeader(), body == null ? -1 : body.length));
                if (body != null) {
                    l.out().write(body);
                }
                l.out().flush();
                return readResponse(l);
            } catch (HttpProtocolException e) {
                recycle(l);
                throw e;
            } catch (IOException e) {
                lost(l, e);
                throw e;
            }
        }
    }

    /** Stream a file as the request body. Cancelled only via {@link #cancelSendFile()}. */
    public byte[] sendFile(HttpRequest request, Path file, LongConsumer onBytesSent) throws IOException {
        return sendFile(request, file, onBytesSent, () -> false);
    }

    /**
     * Stream a file as the request body in {@link #CHUNK_SIZE} chunks, then read the response.
     *
     * Cancellation is checked before every chunk. A cancelled upload leaves a malformed
     * body on the wire, so the connection is terminated and restarted.
     *
     * @param onBytesSent called with the size of every chunk written
     * @param cancelled   per-call cancellation, checked together with {@link #cancelSendFile()}
     * @return raw response bytes
     * @throws TransferCancelledException if cancelled
     */
    public byte[] sendFile(HttpRequest request, Path file, LongConsumer onBytesSent,
                           BooleanSupplier cancelled) throws IOException {
        AtomicBoolean flag = new AtomicBoolean();
        sendCancel = flag;

        // Source errors surface before anything touches the connection
        long size = Files.size(file);
        InputStream src = Files.newInputStream(file);

        try (src) {
            synchronized (ioLock) {
                Link l = requireConnected();
                try {
                    l.out().write(HttpCodec.encodeHead(request, hostHeader(), size));
                    byte[] buf = new byte[CHUNK_SIZE];
                    long sent = 0;
                    while (sent < size) {
                        if (flag.get() || cancelled.getAsBoolean()) {
                            throw new TransferCancelledException(sent);
                        }
                        int n = src.read(buf, 0, (int) Math.min(buf.length, size - sent));
                        if (n < 0) {
                            throw new EOFException("File shrank while sending: " + file);
                        }
                        l.out().write(buf, 0, n);
                        l.out().flush();
                        sent += n;
                        onBytesSent.accept(n);
                    }
                    l.out().flush();
                    return readResponse(l);
                } catch (TransferCancelledException e) {
                    log.info("Upload of {} cancelled after {} bytes, restarting connection", file.getFileName(),
                            e.bytesTransferred());
                    if (l == link) {
                        terminate(true);
                    }
                    throw e;
                } catch (HttpProtocolException e) {
                    recycle(l);
                    throw e;
                } catch (IOException e) {
                    lost(l, e);
                    throw e;
                }
            }
        }
    }

    /** Stream a response body to a file. Cancelled only via {@link #cancelDownloadFile()}. */
    public byte[] downloadToFile(HttpRequest request, Path destination, LongConsumer onBytesReceived) throws IOException {
        return downloadToFile(request, destination, onBytesReceived, () -> false);
    }

    /**
     * Send a request and write the response body to {@code destination}.
     *
     * Body bytes that arrived together with the head are written first. On cancellation the
     * partial file is left for the caller to remove and the connection is recycled.
     *
     * @return the raw response head (through the terminator)
     * @throws TransferCancelledException if cancelled
     */
    public byte[] downloadToFile(HttpRequest request, Path destination, LongConsumer onBytesReceived,
                                 BooleanSupplier cancelled) throws IOException {
        AtomicBoolean flag = new AtomicBoolean();
        downloadCancel = flag;

        OutputStream dst = Files.newOutputStream(destination);

        try (dst) {
            synchronized (ioLock) {
                Link l = requireConnected();
                try {
                    byte[] body = request.body();
                    l.out().write(HttpCodec.encodeHead(request, hostHeader(), body == null ? -1 : body.length));
                    if (body != null) {
                        l.out().write(body);
                    }
                    l.out().flush();

                    byte[] buf = new byte[CHUNK_SIZE];
                    ByteArrayOutputStream acc = new ByteArrayOutputStream();
                    int headEnd = readHead(l.in(), acc, buf);
                    byte[] data = acc.toByteArray();
                    long length = HttpCodec.contentLength(data, headEnd);

                    long received = 0;
                    int spill = data.length - headEnd;
                    if (length >= 0) {
                        spill = (int) Math.min(spill, length);
                    }
                    if (spill > 0) {
                        dst.write(data, headEnd, spill);
                        received += spill;
                        onBytesReceived.accept(spill);
                    }

                    while (length < 0 || received < length) {
                        if (flag.get() || cancelled.getAsBoolean()) {
                            throw new TransferCancelledException(received);
                        }
                        int want = length < 0 ? buf.length : (int) Math.min(buf.length, length - received);
                        int n = l.in().read(buf, 0, want);
                        if (n < 0) {
                            if (length < 0) break;
                            throw new EOFException("Connection closed after " + received + " of " + length + " body bytes");
                        }
                        dst.write(buf, 0, n);
                        received += n;
                        onBytesReceived.accept(n);
                    }
                    dst.flush();

                    if (length < 0) {
                        // Body was framed by EOF
                        recycle(l);
                    }
                    return Arrays.copyOf(data, headEnd);
                } catch (TransferCancelledException e) {
                    log.info("Download to {} cancelled after {} bytes", destination.getFileName(), e.bytesTransferred());
                    recycle(l);
                    throw e;
                } catch (HttpProtocolException e) {
                    recycle(l);
                    throw e;
                } catch (IOException e) {
                    lost(l, e);
                    throw e;
                }
            }
        }
    }

    /** Cancel the in-flight {@link #sendFile} at its next chunk boundary. */
    public void cancelSendFile() {
        sendCancel.set(true);
    }

    /** Cancel the in-flight {@link #downloadToFile} at its next chunk boundary. */
    public void cancelDownloadFile() {
        downloadCancel.set(true);
    }

    /**
     * Close the socket. With {@code tryRestart} observers see {@link ConnectionState#LOST}
     * and a reconnect loop starts; otherwise the close is final.
     */
    public synchronized void terminate(boolean tryRestart) {
        restartAllowed = tryRestart;
        Link l = link;
        link = null;
        if (l != null) {
            closeQuietly(l);
        }
        if (tryRestart) {
            setState(ConnectionState.LOST);
            scheduleReconnect();
        } else {
            if (pendingReconnect != null) {
                pendingReconnect.cancel(false);
                pendingReconnect = null;
            }
            setState(ConnectionState.DISCONNECTED);
        }
    }

    /** Register an observer. It is immediately told the current state. */
    public synchronized void addObserver(ConnectionStateObserver observer) {
        observers.add(observer);
        notifyObserver(observer, state);
    }

    public void removeObserver(ConnectionStateObserver observer) {
        observers.remove(observer);
    }

    public ConnectionState state() { return state; }
    public String host() { return host; }
    public int port() { return port; }

    @Override
    public void close() {
        terminate(false);
        reconnector.shutdownNow();
    }

    // --- internals ---

    private Link dial() throws IOException {
        Socket socket = new Socket();
        try {
            socket.setKeepAlive(keepAlive);
            socket.setTcpNoDelay(true);
            socket.connect(new InetSocketAddress(host, port), timeoutMs);
            socket.setSoTimeout(timeoutMs);
            return new Link(socket, socket.getInputStream(), socket.getOutputStream());
        } catch (IOException e) {
            closeQuietly(socket);
            throw e;
        }
    }

    private Link requireConnected() throws IOException {
        Link l = link;
        if (l == null || state != ConnectionState.CONNECTED) {
            throw new IOException("Not connected to " + hostHeader() + " (" + state + ")");
        }
        return l;
    }

    private byte[] readResponse(Link l) throws IOException {
        byte[] buf = new byte[CHUNK_SIZE];
        ByteArrayOutputStream acc = new ByteArrayOutputStream();
        int headEnd = readHead(l.in(), acc, buf);
        long length = HttpCodec.contentLength(acc.toByteArray(), headEnd);

        if (length < 0) {
            int n;
            while ((n = l.in().read(buf)) >= 0) {
                acc.write(buf, 0, n);
            }
            recycle(l);
            return acc.toByteArray();
        }

        long want = headEnd + length;
        while (acc.size() < want) {
            int n = l.in().read(buf, 0, (int) Math.min(buf.length, want - acc.size()));
            if (n < 0) {
                throw new EOFException("Connection closed after " + (acc.size() - headEnd) + " of " + length + " body bytes");
            }
            acc.write(buf, 0, n);
        }
        byte[] out = acc.toByteArray();
        return out.length > want ? Arrays.copyOf(out, (int) want) : out;
    }

    /** Read until the head terminator. Returns the index of the first body byte in {@code acc}. */
    private static int readHead(InputStream in, ByteArrayOutputStream acc, byte[] buf) throws IOException {
        while (true) {
            int n = in.read(buf);
            if (n < 0) {
                throw new EOFException("Connection closed before response head");
            }
            acc.write(buf, 0, n);
            byte[] data = acc.toByteArray();
            int end = HttpCodec.headEnd(data, data.length);
            if (end >= 0) return end;
            if (data.length > MAX_HEAD_SIZE) {
                throw new HttpProtocolException("Response head exceeds " + MAX_HEAD_SIZE + " bytes");
            }
        }
    }

    /** Replace the socket without a visible state change. Falls back to the LOST path. */
    private void recycle(Link l) {
        synchronized (this) {
            if (link != l) return;
        }
        closeQuietly(l);
        try {
            Link fresh = dial();
            synchronized (this) {
                if (link == l) {
                    link = fresh;
                    log.debug("Recycled connection to {}", hostHeader());
                    return;
                }
            }
            closeQuietly(fresh);
        } catch (IOException e) {
            lost(l, e);
        }
    }

    private void lost(Link l, IOException cause) {
        synchronized (this) {
            if (link != l) return;
            log.warn("Connection to {} lost: {}", hostHeader(), cause.getMessage());
            terminate(true);
        }
    }

    private synchronized void scheduleReconnect() {
        if (!restartAllowed || reconnector.isShutdown()) return;
        if (pendingReconnect != null && !pendingReconnect.isDone()) return;
        reconnectAttempt++;
        long delay = Math.min(RECONNECT_STEP_MS * reconnectAttempt, RECONNECT_MAX_MS);
        log.debug("Reconnecting to {} in {}ms (attempt {})", hostHeader(), delay, reconnectAttempt);
        pendingReconnect = reconnector.schedule(this::reconnect, delay, TimeUnit.MILLISECONDS);
    }

    private void reconnect() {
        Link fresh;
        try {
            fresh = dial();
        } catch (IOException e) {
            log.debug("Reconnect to {} failed: {}", hostHeader(), e.getMessage());
            synchronized (this) {
                pendingReconnect = null;
                scheduleReconnect();
            }
            return;
        }

        synchronized (this) {
            pendingReconnect = null;
            if (restartAllowed && link == null) {
                link = fresh;
                reconnectAttempt = 0;
                log.info("Reconnected to {}", hostHeader());
                setState(ConnectionState.CONNECTED);
                return;
            }
        }
        closeQuietly(fresh);
    }

    private synchronized void setState(ConnectionState newState) {
        if (newState == state) return;
        log.debug("Connection {} -> {}", state, newState);
        state = newState;
        for (ConnectionStateObserver observer : observers) {
            notifyObserver(observer, newState);
        }
    }

    private void notifyObserver(ConnectionStateObserver observer, ConnectionState s) {
        try {
            observer.onStateChanged(this, s);
        } catch (RuntimeException e) {
            log.warn("Connection observer failed: {}", e.getMessage(), e);
        }
    }

    private String hostHeader() {
        return host + ":" + port;
    }

    private static void closeQuietly(Link l) {
        try {
            l.socket().close();
        } catch (IOException e) {
            log.debug("Error closing socket: {}", e.getMessage());
        }
    }

    private static void closeQuietly(Socket s) {
        try {
            s.close();
        } catch (IOException e) {
            log.debug("Error closing socket: {}", e.getMessage());
        }
    }
}
