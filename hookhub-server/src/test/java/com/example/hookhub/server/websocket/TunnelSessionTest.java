package com.example.hookhub.server.websocket;

import com.example.hookhub.protocol.DecodeException;
import com.example.hookhub.protocol.Handshake;
import com.example.hookhub.protocol.HandshakeAck;
import com.example.hookhub.protocol.HandshakeReject;
import com.example.hookhub.protocol.HttpVerb;
import com.example.hookhub.protocol.RelayedRequest;
import com.example.hookhub.protocol.TunnelMessage;
import com.example.hookhub.protocol.TunnelMessageCodec;
import com.example.hookhub.server.security.HandshakeVerifier;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.web.socket.BinaryMessage;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class TunnelSessionTest {

    private final TunnelMessageCodec codec = new TunnelMessageCodec();
    private final HandshakeVerifier verifier = new HandshakeVerifier("abc123");

    private ExecutorService executor;
    private TunnelHub hub;

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
        hub = new TunnelHub(executor, RetryTemplate.builder().maxAttempts(1).build(), 16);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void testValidHandshakeRegistersAndAcksFirst() throws Exception {
        List<byte[]> sink = new CopyOnWriteArrayList<>();
        WebSocketSession socket = TunnelHubTest.recordingSocket("good", sink);
        TunnelSession session = new TunnelSession(socket, hub, codec, verifier);

        session.onFrame(codec.encode(Handshake.builder().secret("abc123").build()));
        hub.broadcast(codec.encode(request("/after-ack")));

        assertEquals(TunnelSession.State.AUTHENTICATED, session.getState());
        assertTrue(hub.isRegistered("good"));

        verify(socket, timeout(2000).times(2)).sendMessage(any());
        TunnelMessage first = codec.decode(sink.get(0));
        assertTrue(first instanceof HandshakeAck);
        assertEquals("Tunnel connected successfully", ((HandshakeAck) first).getMessage());
        assertEquals("/after-ack", codec.decodeRequest(sink.get(1)).getFullPath());
    }

    @Test
    void testWrongSecretIsRejected() throws Exception {
        WebSocketSession socket = TunnelHubTest.mockSocket("intruder");
        TunnelSession session = new TunnelSession(socket, hub, codec, verifier);

        session.onFrame(codec.encode(Handshake.builder().secret("wrong").build()));

        assertEquals(TunnelSession.State.CLOSED, session.getState());
        assertFalse(hub.isRegistered("intruder"));
        assertEquals(0, hub.getActiveConnectionCount());
        assertEquals("Invalid secret", sentRejection(socket).getReason());
        assertPolicyViolationClose(socket);
    }

    @Test
    void testProtocolVersionMismatchIsRejected() throws Exception {
        WebSocketSession socket = TunnelHubTest.mockSocket("old-client");
        TunnelSession session = new TunnelSession(socket, hub, codec, verifier);

        session.onFrame(codec.encode(Handshake.builder().secret("abc123").protocolVersion(99).build()));

        assertEquals(TunnelSession.State.CLOSED, session.getState());
        assertFalse(hub.isRegistered("old-client"));
        String reason = sentRejection(socket).getReason();
        assertTrue(reason.contains("99"), reason);
        assertPolicyViolationClose(socket);
    }

    @Test
    void testMalformedFirstFrameIsRejected() throws Exception {
        WebSocketSession socket = TunnelHubTest.mockSocket("garbage");
        TunnelSession session = new TunnelSession(socket, hub, codec, verifier);

        session.onFrame(new byte[]{0x01, 0x02, 0x03});

        assertEquals(TunnelSession.State.CLOSED, session.getState());
        assertEquals("Malformed handshake", sentRejection(socket).getReason());
        assertPolicyViolationClose(socket);
    }

    @Test
    void testNonHandshakeFirstFrameIsRejected() throws Exception {
        WebSocketSession socket = TunnelHubTest.mockSocket("confused");
        TunnelSession session = new TunnelSession(socket, hub, codec, verifier);

        session.onFrame(codec.encode(request("/hook")));

        assertEquals(TunnelSession.State.CLOSED, session.getState());
        assertEquals("Expected handshake", sentRejection(socket).getReason());
        assertFalse(hub.isRegistered("confused"));
    }

    @Test
    void testHandshakeTimeoutClosesConnection() throws Exception {
        WebSocketSession socket = TunnelHubTest.mockSocket("silent");
        TunnelSession session = new TunnelSession(socket, hub, codec, verifier);

        session.handshakeTimedOut();

        assertEquals(TunnelSession.State.CLOSED, session.getState());
        assertEquals("Handshake timeout", sentRejection(socket).getReason());
        assertPolicyViolationClose(socket);
    }

    @Test
    void testScheduledTimeoutFiresWithoutHandshake() throws Exception {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.initialize();
        try {
            WebSocketSession socket = TunnelHubTest.mockSocket("idle");
            TunnelSession session = new TunnelSession(socket, hub, codec, verifier);

            session.startHandshakeTimer(scheduler, Duration.ofMillis(50));

            verify(socket, timeout(2000)).close(any(CloseStatus.class));
            assertEquals(TunnelSession.State.CLOSED, session.getState());
        } finally {
            scheduler.shutdown();
        }
    }

    @Test
    void testTimeoutAfterAuthenticationIsIgnored() throws Exception {
        WebSocketSession socket = TunnelHubTest.recordingSocket("quick", new CopyOnWriteArrayList<>());
        TunnelSession session = new TunnelSession(socket, hub, codec, verifier);

        session.onFrame(codec.encode(Handshake.builder().secret("abc123").build()));
        session.handshakeTimedOut();

        assertEquals(TunnelSession.State.AUTHENTICATED, session.getState());
        assertTrue(hub.isRegistered("quick"));
        verify(socket, never()).close(any(CloseStatus.class));
    }

    @Test
    void testFramesAfterAuthenticationAreIgnored() throws Exception {
        WebSocketSession socket = TunnelHubTest.recordingSocket("chatty", new CopyOnWriteArrayList<>());
        TunnelSession session = new TunnelSession(socket, hub, codec, verifier);

        session.onFrame(codec.encode(Handshake.builder().secret("abc123").build()));
        session.onFrame(codec.encode(Handshake.builder().secret("wrong").build()));
        session.onFrame(new byte[]{0x7f});

        assertEquals(TunnelSession.State.AUTHENTICATED, session.getState());
        assertTrue(hub.isRegistered("chatty"));
        verify(socket, never()).close(any(CloseStatus.class));
    }

    @Test
    void testTransportCloseUnregisters() throws Exception {
        WebSocketSession socket = TunnelHubTest.recordingSocket("leaving", new CopyOnWriteArrayList<>());
        TunnelSession session = new TunnelSession(socket, hub, codec, verifier);
        session.onFrame(codec.encode(Handshake.builder().secret("abc123").build()));

        session.onTransportClosed(CloseStatus.NORMAL);
        session.onTransportClosed(CloseStatus.NORMAL);

        assertEquals(TunnelSession.State.CLOSED, session.getState());
        assertFalse(hub.isRegistered("leaving"));
        assertEquals(0, hub.broadcast(codec.encode(request("/late"))));

        // a closed session never authenticates again
        session.onFrame(codec.encode(Handshake.builder().secret("abc123").build()));
        assertFalse(hub.isRegistered("leaving"));
    }

    @Test
    void testCloseBeforeHandshakeNeverRegisters() throws Exception {
        WebSocketSession socket = TunnelHubTest.mockSocket("early");
        TunnelSession session = new TunnelSession(socket, hub, codec, verifier);

        session.close(CloseStatus.SERVER_ERROR);
        session.onFrame(codec.encode(Handshake.builder().secret("abc123").build()));

        assertEquals(TunnelSession.State.CLOSED, session.getState());
        assertFalse(hub.isRegistered("early"));
        verify(socket, times(1)).close(CloseStatus.SERVER_ERROR);
    }

    private HandshakeReject sentRejection(WebSocketSession socket) throws IOException, DecodeException {
        ArgumentCaptor<BinaryMessage> captor = ArgumentCaptor.forClass(BinaryMessage.class);
        verify(socket).sendMessage(captor.capture());
        TunnelMessage message = codec.decode(TunnelHubTest.payload(captor.getValue()));
        assertTrue(message instanceof HandshakeReject, "expected a rejection but got " + message);
        return (HandshakeReject) message;
    }

    private static void assertPolicyViolationClose(WebSocketSession socket) throws IOException {
        ArgumentCaptor<CloseStatus> captor = ArgumentCaptor.forClass(CloseStatus.class);
        verify(socket).close(captor.capture());
        assertEquals(CloseStatus.POLICY_VIOLATION.getCode(), captor.getValue().getCode());
    }

    private static RelayedRequest request(String path) {
        return RelayedRequest.builder()
                .method(HttpVerb.POST)
                .fullPath(path)
                .body(new byte[]{'{', '}'})
                .build();
    }
}
