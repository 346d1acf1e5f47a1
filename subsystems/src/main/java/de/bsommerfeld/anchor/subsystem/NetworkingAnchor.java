package de.bsommerfeld.anchor.subsystem;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.anchor.core.sink.KeepAlive;

import javax.net.SocketFactory;
import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLParameters;
import javax.net.ssl.SSLServerSocket;
import javax.net.ssl.SSLSocket;
import java.io.IOException;
import java.net.InetAddress;
import java.net.Socket;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.nio.channels.SocketChannel;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Networking surface: name resolution, the HTTP client facade, plain and
 * NIO stream sockets, and TLS 1.3 connection and listener sockets.
 *
 * <p>
 * Nothing connects. Sockets are created unconnected or unbound and closed by
 * try-with-resources; the HTTP request is built but never sent. Host name
 * resolution is the only call that may block, and it is bounded by the
 * platform resolver's own timeout.
 */
@Singleton
public class NetworkingAnchor extends AbstractSubsystemAnchor {

    /** Resolves the local host name; replaced in tests. */
    @FunctionalInterface
    interface HostResolver {
        String localHostName() throws IOException;
    }

    static final URI PLACEHOLDER = URI.create("https://example.invalid/");
    private static final String TLS = "TLSv1.3";

    private final HostResolver resolver;
    private final SocketFactory socketFactory;

    @Inject
    public NetworkingAnchor() {
        this(() -> InetAddress.getLocalHost().getHostName(), SocketFactory.getDefault());
    }

    NetworkingAnchor(HostResolver resolver, SocketFactory socketFactory) {
        this.resolver = resolver;
        this.socketFactory = socketFactory;
    }

    @Override
    public String name() {
        return "networking";
    }

    @Override
    protected List<EntryPoint> entryPoints() {
        return List.of(
                new EntryPoint("resolve-local-host", this::resolveLocalHost),
                new EntryPoint("http-client", this::buildHttpClient),
                new EntryPoint("stream-socket", this::openStreamSocket),
                new EntryPoint("socket-channel", this::openSocketChannel),
                new EntryPoint("secure-transport", this::referenceSecureTransport));
    }

    private void resolveLocalHost() throws IOException {
        KeepAlive.accept(resolver.localHostName());
    }

    /**
     * The client runs on an executor owned here, which is shut down on return.
     * {@link HttpClient} is not closeable on this JDK: its selector manager is
     * a daemon thread that stops only once the client becomes unreachable.
     */
    private void buildHttpClient() {
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            HttpClient client = HttpClient.newBuilder()
                    .executor(executor)
                    .followRedirects(HttpClient.Redirect.NORMAL)
                    .connectTimeout(Duration.ofSeconds(1))
                    .build();
            HttpRequest request = HttpRequest.newBuilder(PLACEHOLDER)
                    .header("User-Agent", "metadata-anchor")
                    .GET()
                    .build();
            KeepAlive.accept(client.version(), request.headers().map());
        } finally {
            executor.shutdownNow();
        }
    }

    private void openStreamSocket() throws IOException {
        try (Socket socket = socketFactory.createSocket()) {
            // forces the underlying descriptor to be created
            KeepAlive.accept(socket.getReceiveBufferSize());
        }
    }

    private void openSocketChannel() throws IOException {
        try (SocketChannel channel = SocketChannel.open()) {
            channel.configureBlocking(false);
            KeepAlive.accept(channel.isConnectionPending());
        }
    }

    private void referenceSecureTransport() throws Exception {
        SSLContext context = SSLContext.getInstance(TLS);
        context.init(null, null, null);
        SSLParameters parameters = context.getDefaultSSLParameters();
        parameters.setProtocols(new String[] {TLS});

        try (SSLSocket connection = (SSLSocket) context.getSocketFactory().createSocket();
                SSLServerSocket listener = (SSLServerSocket) context.getServerSocketFactory().createServerSocket()) {
            connection.setSSLParameters(parameters);
            listener.setSSLParameters(parameters);
            KeepAlive.accept(connection.getEnabledProtocols(), listener.getEnabledCipherSuites());
        }
    }
}
