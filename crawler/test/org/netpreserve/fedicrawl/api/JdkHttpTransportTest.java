package org.netpreserve.fedicrawl.api;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;

import static org.junit.jupiter.api.Assertions.*;

class JdkHttpTransportTest {
    @Test
    void parsesDeltaSeconds() {
        assertEquals(Duration.ofSeconds(120), JdkHttpTransport.parseRetryAfter("120"));
        assertEquals(Duration.ZERO, JdkHttpTransport.parseRetryAfter("-5"));
    }

    @Test
    void parsesHttpDate() {
        String header = DateTimeFormatter.RFC_1123_DATE_TIME.format(ZonedDateTime.now().plusMinutes(2));
        Duration delay = JdkHttpTransport.parseRetryAfter(header);
        assertNotNull(delay);
        assertTrue(delay.compareTo(Duration.ofSeconds(100)) > 0 && delay.compareTo(Duration.ofSeconds(121)) <= 0,
                delay.toString());
        assertEquals(Duration.ZERO, JdkHttpTransport.parseRetryAfter("Wed, 21 Oct 2015 07:28:00 GMT"));
    }

    @Test
    void ignoresGarbage() {
        assertNull(JdkHttpTransport.parseRetryAfter("soon"));
    }
}
