package com.lifter.resolution.source;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class SourceSessionTest {

    private SourceSession session;

    @BeforeEach
    void setUp() {
        session = new SourceSession("test", Duration.ofMillis(200));
    }

    @AfterEach
    void tearDown() {
        session.close();
    }

    @Test
    @DisplayName("Should return the call's value")
    void testCall() {
        assertEquals("ok", session.call("op", () -> "ok"));
    }

    @Test
    @DisplayName("Should time out a slow call")
    void testTimeout() {
        CountDownLatch never = new CountDownLatch(1);

        SourceUnavailableException e = assertThrows(SourceUnavailableException.class,
                () -> session.call("slow", () -> never.await(10, TimeUnit.SECONDS)));

        assertTrue(e.getMessage().contains("timed out"));
    }

    @Test
    @DisplayName("Should wrap a failing call")
    void testFailure() {
        SourceUnavailableException e = assertThrows(SourceUnavailableException.class,
                () -> session.call("io", () -> {
                    throw new IOException("connection reset");
                }));

        assertInstanceOf(IOException.class, e.getCause());
    }

    @Test
    @DisplayName("Should pass a source failure through unchanged")
    void testSourceFailurePassesThrough() {
        SourceUnavailableException original = new SourceUnavailableException("down");

        SourceUnavailableException e = assertThrows(SourceUnavailableException.class,
                () -> session.call("op", () -> {
                    throw original;
                }));

        assertSame(original, e);
    }

    @Test
    @DisplayName("Should refuse calls after close")
    void testClosed() {
        session.close();

        assertThrows(SourceUnavailableException.class, () -> session.call("op", () -> "late"));
    }

    @Test
    @DisplayName("Should require a positive timeout")
    void testInvalidTimeout() {
        assertThrows(IllegalArgumentException.class, () -> new SourceSession("bad", Duration.ZERO));
    }
}
