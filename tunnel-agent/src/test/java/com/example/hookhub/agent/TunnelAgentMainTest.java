package com.example.hookhub.agent;

import com.example.hookhub.agent.history.HistoryItem;
import com.example.hookhub.agent.history.HistoryStore;
import com.example.hookhub.agent.profile.Profiles;
import com.example.hookhub.protocol.HttpHeader;
import com.example.hookhub.protocol.HttpVerb;
import com.example.hookhub.protocol.RelayedRequest;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class TunnelAgentMainTest {

    @TempDir
    Path home;

    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;
    private TunnelAgentMain main;

    @BeforeEach
    void setUp() {
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
        main = new TunnelAgentMain(home,
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    @Test
    void testNoCommandPrintsUsage() {
        assertEquals(1, main.run(new String[0]));
        assertTrue(stderr().contains("Usage:"));
    }

    @Test
    void testUnknownCommand() {
        assertEquals(1, main.run(new String[]{"launch"}));
        assertTrue(stderr().contains("Unknown command: launch"));
    }

    @Test
    void testProfileLifecycle() throws IOException {
        assertEquals(0, main.run(new String[]{"profiles", "add", "work",
                "--remote=wss://hooks.example.com", "--secret=s3cret", "--local=http://localhost:3000"}));
        assertTrue(stdout().contains("Profile work added"));

        assertEquals(0, main.run(new String[]{"profiles", "list"}));
        assertTrue(stdout().contains("[work] Remote: wss://hooks.example.com Local: http://localhost:3000"));
        assertFalse(stdout().contains("s3cret"));

        assertEquals(1, main.run(new String[]{"profiles", "add", "work",
                "--remote=ws://other", "--secret=x", "--local=http://localhost:4000"}));
        assertTrue(stderr().contains("Error: profile work already exists"));

        assertEquals(0, main.run(new String[]{"profiles", "delete", "work"}));
        assertTrue(Profiles.load(home).list().isEmpty());

        assertEquals(1, main.run(new String[]{"profiles", "delete", "work"}));
        assertTrue(stderr().contains("profile work doesn't exist"));
    }

    @Test
    void testProfileWithoutNameIsDefault() throws IOException {
        assertEquals(0, main.run(new String[]{"profiles", "add",
                "--remote=ws://localhost:8080", "--secret=abc123", "--local=http://localhost:3000"}));

        assertTrue(Profiles.load(home).get(Profiles.DEFAULT_PROFILE).isPresent());
    }

    @Test
    void testInvalidProfileIsNotSaved() throws IOException {
        assertEquals(1, main.run(new String[]{"profiles", "add", "bad",
                "--remote=http://hooks.example.com", "--secret=s", "--local=http://localhost:3000"}));

        assertTrue(stderr().contains("remote must use ws or wss scheme"));
        assertTrue(Profiles.load(home).list().isEmpty());
    }

    @Test
    void testConnectWithUnknownProfileFails() {
        assertEquals(1, main.run(new String[]{"connect", "--profile=nowhere"}));
        assertTrue(stderr().contains("Profile nowhere doesn't exist"));
    }

    @Test
    void testHistoryListDeleteClear() throws IOException {
        assertEquals(0, main.run(new String[]{"history", "list"}));
        assertTrue(stdout().contains("History is empty"));

        HistoryStore store = new HistoryStore(home);
        String first = store.add(item("/first"));
        store.add(item("/second"));

        assertEquals(0, main.run(new String[]{"history"}));
        assertTrue(stdout().contains("[" + first + " "));
        assertTrue(stdout().contains("POST /second"));

        assertEquals(0, main.run(new String[]{"history", "delete", first}));
        assertEquals(1, main.run(new String[]{"history", "delete", first}));
        assertTrue(stderr().contains(first + " not found"));

        assertEquals(0, main.run(new String[]{"history", "clear"}));
        assertTrue(stdout().contains("History has been cleared (1 item(s))"));
        assertTrue(store.list().isEmpty());
    }

    @Test
    void testHistoryReplayToOverriddenLocal() throws Exception {
        BlockingQueue<String> received = new LinkedBlockingQueue<>();
        HttpServer server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", exchange -> {
            try (InputStream body = exchange.getRequestBody()) {
                received.add(exchange.getRequestMethod() + " " + exchange.getRequestURI() + " "
                        + new String(body.readAllBytes(), StandardCharsets.UTF_8) + " "
                        + exchange.getRequestHeaders().getFirst("X-Replay"));
            }
            exchange.sendResponseHeaders(200, -1);
            exchange.close();
        });
        server.start();
        try {
            String id = new HistoryStore(home).add(item("/orders?id=9"));

            int status = main.run(new String[]{"history", "replay", id,
                    "--local=http://127.0.0.1:" + server.getAddress().getPort() + "/ignored"});

            assertEquals(0, status, stderr());
            assertEquals("POST /orders?id=9 {\"id\":9} yes", received.poll(5, TimeUnit.SECONDS));
            assertTrue(stdout().contains("Replayed " + id + ": HTTP 200"));
        } finally {
            server.stop(0);
        }
    }

    @Test
    void testReplayOfMissingItem() {
        assertEquals(1, main.run(new String[]{"history", "replay", "deadbeef"}));
        assertTrue(stderr().contains("deadbeef not found"));
    }

    @Test
    void testArgumentParsing() {
        String[] args = {"connect", "--server=ws://a=b", "--secret=x", "extra"};

        assertEquals("ws://a=b", TunnelAgentMain.getArg(args, "--server", null));
        assertEquals("fallback", TunnelAgentMain.getArg(args, "--target", "fallback"));
        assertEquals(List.of("connect", "extra"), TunnelAgentMain.positional(args));
    }

    private static HistoryItem item(String path) {
        RelayedRequest request = RelayedRequest.builder()
                .method(HttpVerb.POST)
                .fullPath(path)
                .headers(List.of(new HttpHeader("X-Replay", "yes")))
                .body("{\"id\":9}".getBytes(StandardCharsets.UTF_8))
                .build();
        return HistoryItem.of(request, Instant.now(), URI.create("http://127.0.0.1:1"));
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String stderr() {
        return err.toString(StandardCharsets.UTF_8);
    }
}
