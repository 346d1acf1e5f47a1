package de.bsommerfeld.anchor.subsystem;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import javax.net.SocketFactory;
import java.io.IOException;
import java.net.Socket;
import java.net.SocketException;
import java.net.UnknownHostException;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class NetworkingAnchorTest {

    @Mock
    private SocketFactory socketFactory;

    @Test
    void anchor_shouldCloseSocketWhenCallThrows() throws IOException {
        FailingSocket socket = new FailingSocket();
        when(socketFactory.createSocket()).thenReturn(socket);

        AnchorReport report = new NetworkingAnchor(() -> "localhost", socketFactory).anchor();

        assertTrue(socket.isClosed());
        assertFalse(outcome(report, "stream-socket").succeeded());
        verify(socketFactory).createSocket();
    }

    @Test
    void anchor_shouldContinueWhenHostResolutionFails() throws IOException {
        when(socketFactory.createSocket()).thenReturn(new Socket());

        AnchorReport report = new NetworkingAnchor(() -> {
            throw new UnknownHostException("sandbox");
        }, socketFactory).anchor();

        assertEquals(5, report.outcomes().size());
        assertFalse(outcome(report, "resolve-local-host").succeeded());
        assertTrue(outcome(report, "stream-socket").succeeded());
        assertTrue(outcome(report, "http-client").succeeded());
    }

    @Test
    void anchor_shouldNeverThrowWithDefaultCollaborators() {
        AnchorReport report = assertDoesNotThrow(() -> new NetworkingAnchor().anchor());

        assertEquals("networking", report.subsystem());
        assertEquals(
                java.util.List.of("resolve-local-host", "http-client", "stream-socket", "socket-channel", "secure-transport"),
                report.outcomes().stream().map(AnchorReport.Outcome::entryPoint).collect(Collectors.toList()));
    }

    @Test
    void anchor_shouldReferenceSecureTransportOffline() {
        AnchorReport report = new NetworkingAnchor().anchor();
        assertTrue(outcome(report, "secure-transport").succeeded(), outcome(report, "secure-transport").detail());
    }

    private static AnchorReport.Outcome outcome(AnchorReport report, String entryPoint) {
        return report.outcomes().stream()
                .filter(o -> o.entryPoint().equals(entryPoint))
                .findFirst()
                .orElseThrow();
    }

    private static final class FailingSocket extends Socket {
        @Override
        public synchronized int getReceiveBufferSize() throws SocketException {
            throw new SocketException("descriptor limit reached");
        }
    }
}
