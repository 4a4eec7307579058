package com.alterante.relay.server;

import com.alterante.relay.http.ConnectionState;
import com.alterante.relay.http.ConnectionStateObserver;
import com.alterante.relay.http.HttpConnection;
import com.alterante.relay.http.HttpProtocolException;
import com.alterante.relay.http.HttpRequest;
import com.alterante.relay.http.HttpResponse;
import com.alterante.relay.queue.CommandQueue;
import com.alterante.relay.transfer.UploadTarget;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;
import java.util.function.LongConsumer;

/**
 * An authorized session with the processing server.
 *
 * Owns the {@link HttpConnection} and gates the server {@link CommandQueue} on it: the
 * queue runs only while the connection is up and authorized. A restored connection is
 * authorized again before listeners see it as CONNECTED.
 */
public class ServerSession implements ConnectionStateObserver, UploadTarget, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ServerSession.class);

    private final String host;
    private final int port;
    private final String token;
    private final String sessionId;
    private final int timeoutMs;
    private final boolean keepAlive;
    private final CommandQueue queue;
    private final List<Consumer<ConnectionState>> stateListeners = new CopyOnWriteArrayList<>();

    private final ExecutorService authorizer = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "server-auth");
        t.setDaemon(true);
        return t;
    });

    private volatile HttpConnection connection;
    private volatile boolean needsAuthorization;

    public ServerSession(String host, int port, String token, String sessionId,
                         int timeoutMs, boolean keepAlive, CommandQueue queue) {
        this.host = host;
        this.port = port;
        this.token = token;
        this.sessionId = sessionId;
        this.timeoutMs = timeoutMs;
        this.keepAlive = keepAlive;
        this.queue = queue;
    }

    /** Called on every distinct connection state, on the thread that caused it. */
    public void addStateListener(Consumer<ConnectionState> listener) {
        stateListeners.add(listener);
    }

    /**
     * Connect and authorize. Blocks until the server accepted the token.
     *
     * @throws HttpProtocolException if the server refuses the token
     * @throws IOException           if the server cannot be reached
     */
    public void connect() throws IOException {
        HttpConnection c = HttpConnection.open(host, port, timeoutMs, keepAlive);
        try {
            authorize(c);
        } catch (IOException e) {
            c.close();
            throw e;
        }
        log.info("Authorized with {}:{}", host, port);
        connection = c;
        c.addObserver(this);
    }

    /** Close the connection cleanly. Listeners see DISCONNECTED. */
    public void disconnect() {
        HttpConnection c = connection;
        if (c != null) {
            c.terminate(false);
        }
    }

    @Override
    public void onStateChanged(HttpConnection c, ConnectionState state) {
        log.debug("Server connection {}", state);
        if (state == ConnectionState.LOST) {
            needsAuthorization = true;
        } else if (state == ConnectionState.CONNECTED && needsAuthorization) {
            needsAuthorization = false;
            reauthorize(c);
            return;
        }
        publish(state);
    }

    private void publish(ConnectionState state) {
        for (Consumer<ConnectionState> l : stateListeners) {
            l.accept(state);
        }
        queue.setEnabled(state == ConnectionState.CONNECTED);
    }

    private void authorize(HttpConnection c) throws IOException {
        HttpResponse response = HttpResponse.parse(c.send(request("/node/connectuser", HttpRequest.Method.GET)));
        if (response.status() != 200) {
            throw new HttpProtocolException("Authorization refused (" + response.status() + " " + response.reason() + ")");
        }
    }

    /** Off the observer thread: it holds the connection's monitor. */
    private void reauthorize(HttpConnection c) {
        try {
            authorizer.execute(() -> {
                try {
                    authorize(c);
                    log.info("Authorized again with {}:{}", host, port);
                    publish(ConnectionState.CONNECTED);
                } catch (HttpProtocolException e) {
                    log.error("Server refused the restored session: {}", e.getMessage());
                    c.terminate(false);
                } catch (IOException e) {
                    // The connection reports the loss itself and the next reconnect tries again
                    log.warn("Authorization after reconnect failed: {}", e.getMessage());
                }
            });
        } catch (RejectedExecutionException e) {
            log.debug("Session closed, not authorizing the restored connection");
        }
    }

    /** A request carrying the session's credentials. */
    public HttpRequest request(String path, HttpRequest.Method method) {
        HttpRequest r = new HttpRequest(path, method, null, null)
                .withHeader("Authorization", "Bearer " + token);
        if (sessionId != null && !sessionId.isEmpty()) {
            r = r.withHeader("Session", sessionId);
        }
        return r;
    }

    /**
     * Add a file to the server's project.
     *
     * @return the task id the server assigned
     * @throws HttpProtocolException if the response carries no task id
     */
    @Override
    public String upload(String name, Path file, LongConsumer onBytesSent, BooleanSupplier cancelled) throws IOException {
        HttpRequest r = request("/project/command?name=add&param1=" + encode(name), HttpRequest.Method.POST);
        HttpResponse response = HttpResponse.parse(requireConnection().sendFile(r, file, onBytesSent, cancelled));
        JsonNode json = response.json();
        JsonNode taskId = json.get("taskID");
        if (taskId != null && !taskId.isNull()) {
            return taskId.asText();
        }
        throw new HttpProtocolException(serverError(json, response));
    }

    /** Names of the files the project already holds. */
    public List<String> listRemoteFiles() throws IOException {
        HttpResponse response = HttpResponse.parse(
                requireConnection().send(request("/project/list?folder=data", HttpRequest.Method.GET)));
        if (!response.isOk()) {
            throw new HttpProtocolException("Cannot list server files (" + response.status() + ")");
        }
        JsonNode json = response.json();
        if (!json.isArray()) {
            throw new HttpProtocolException("File list is not a JSON array");
        }
        List<String> names = new ArrayList<>();
        for (JsonNode n : json) {
            names.add(n.asText());
        }
        return names;
    }

    /**
     * Download a processing output to {@code destination}. The file is removed unless
     * the server answered 200.
     */
    public void downloadOutput(String name, Path destination, LongConsumer onBytesReceived,
                               BooleanSupplier cancelled) throws IOException {
        HttpRequest r = request("/project/download?name=" + encode(name) + "&folder=output", HttpRequest.Method.GET);
        boolean ok = false;
        try {
            byte[] head = requireConnection().downloadToFile(r, destination, onBytesReceived, cancelled);
            HttpResponse response = HttpResponse.parse(head);
            if (!response.isOk()) {
                throw new HttpProtocolException("Cannot download " + name + " (" + response.status() + " "
                        + response.reason() + ")");
            }
            ok = true;
        } finally {
            if (!ok) {
                Files.deleteIfExists(destination);
            }
        }
    }

    public ConnectionState state() {
        HttpConnection c = connection;
        return c == null ? ConnectionState.STARTED : c.state();
    }

    public CommandQueue queue() { return queue; }

    @Override
    public void close() {
        authorizer.shutdownNow();
        HttpConnection c = connection;
        if (c != null) {
            c.close();
        }
    }

    private HttpConnection requireConnection() throws IOException {
        HttpConnection c = connection;
        if (c == null) {
            throw new IOException("Not connected to " + host + ":" + port);
        }
        return c;
    }

    private static String serverError(JsonNode json, HttpResponse response) {
        JsonNode code = json.get("code");
        JsonNode message = json.get("message");
        if (code == null && message == null) {
            return "Unexpected server response (" + response.status() + "): " + response.bodyText();
        }
        return (message != null ? message.asText() : "Server error") + (code != null ? " (code " + code.asText() + ")" : "");
    }

    private static String encode(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
