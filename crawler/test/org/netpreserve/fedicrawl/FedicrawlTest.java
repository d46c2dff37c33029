package org.netpreserve.fedicrawl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.netpreserve.fedicrawl.config.ConfigurationException;
import org.netpreserve.fedicrawl.config.CrawlerConfig;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FedicrawlTest {
    @TempDir
    Path tempDir;

    private Path writeConfig(String yaml) throws IOException {
        Path file = tempDir.resolve("config.yaml");
        Files.writeString(file, yaml, StandardCharsets.UTF_8);
        return file;
    }

    @Test
    void defaults() throws IOException {
        CrawlerConfig config = Fedicrawl.loadConfig(null, List.of());
        assertEquals(List.of(), config.seeds());
        assertEquals("https://public.api.bsky.app", config.api().baseUrl());
        assertEquals(3, config.traversal().maxDepth());
        assertEquals(10, config.traversal().minFollowerCount());
        assertEquals(Duration.ofDays(7), config.dedup().ttl());
        assertEquals(10, config.checkpoint().retention());
        assertEquals(30, config.rateLimits().limitsFor("searchActors").requestsPerMinute());
    }

    @Test
    void userFileOverridesOnlyGivenKeys() throws IOException {
        Path file = writeConfig("""
                seeds: [alice.test]
                traversal:
                  maxDepth: 1
                rateLimits:
                  endpoints:
                    getFollowers: { requestsPerMinute: 10, burstLimit: 2 }
                """);
        CrawlerConfig config = Fedicrawl.loadConfig(file, List.of());
        assertEquals(List.of("alice.test"), config.seeds());
        assertEquals(1, config.traversal().maxDepth());
        assertEquals(1000, config.traversal().maxFollowersPerNode());
        assertEquals(10, config.rateLimits().limitsFor("getFollowers").requestsPerMinute());
        assertEquals(100, config.rateLimits().limitsFor("getProfile").requestsPerMinute());
        assertEquals(60, config.rateLimits().requestsPerMinute());
    }

    @Test
    void commandLineSeedsReplaceConfiguredOnes() throws IOException {
        Path file = writeConfig("seeds: [alice.test, bob.test]\n");
        CrawlerConfig config = Fedicrawl.loadConfig(file, List.of("carol.test"));
        assertEquals(List.of("carol.test"), config.seeds());
    }

    @Test
    void invalidValueIsConfigurationError() throws IOException {
        Path file = writeConfig("traversal:\n  maxDepth: 9\n");
        var e = assertThrows(ConfigurationException.class, () -> Fedicrawl.loadConfig(file, List.of()));
        assertTrue(e.getMessage().contains("traversal.maxDepth"), e.getMessage());
    }

    @Test
    void mergeReplacesArraysAndScalars() throws IOException {
        var mapper = new ObjectMapper();
        JsonNode base = mapper.readTree("{\"a\":{\"b\":1,\"c\":[1,2]},\"d\":\"x\"}");
        JsonNode override = mapper.readTree("{\"a\":{\"c\":[3]},\"d\":\"y\",\"e\":true}");
        JsonNode merged = Fedicrawl.deepMerge(base, override);
        assertEquals(mapper.readTree("{\"a\":{\"b\":1,\"c\":[3]},\"d\":\"y\",\"e\":true}"), merged);
        assertEquals(1, base.path("a").path("c").get(0).asInt(), "base tree is left untouched");
    }
}
