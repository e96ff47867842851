package com.example.hookhub.agent.profile;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ProfileTest {

    @Test
    void testPrepareNormalizesUrls() {
        Profile prepared = new Profile("wss://Hooks.Example.com:8443/ignored/path?x=1", "s3cret",
                "http://localhost:3000/api/hooks").prepare();

        assertEquals("wss://Hooks.Example.com:8443/__hookhub__/", prepared.getRemote());
        assertEquals("http://localhost:3000", prepared.getLocal());
        assertEquals("s3cret", prepared.getSecret());
    }

    @Test
    void testRemoteMustBeWebSocket() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> new Profile("https://hooks.example.com", "s", "http://localhost:3000").prepare());
        assertEquals("remote must use ws or wss scheme", e.getMessage());
    }

    @Test
    void testLocalMustBeHttp() {
        assertThrows(IllegalArgumentException.class,
                () -> new Profile("ws://hooks.example.com", "s", "ftp://localhost").prepare());
        assertThrows(IllegalArgumentException.class,
                () -> new Profile("ws://hooks.example.com", "s", "localhost:3000").prepare());
    }

    @Test
    void testMissingValuesAreRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> new Profile(null, "s", "http://localhost").prepare());
        assertThrows(IllegalArgumentException.class,
                () -> new Profile("ws://hooks.example.com", "", "http://localhost").prepare());
        assertThrows(IllegalArgumentException.class,
                () -> new Profile("ws://hooks.example.com", "s", null).prepare());
        assertThrows(IllegalArgumentException.class,
                () -> new Profile("ws://bad host", "s", "http://localhost").prepare());
    }

    @Test
    void testToStringHidesSecret() {
        String text = new Profile("ws://a", "top-secret", "http://b").toString();

        assertFalse(text.contains("top-secret"), text);
    }
}
