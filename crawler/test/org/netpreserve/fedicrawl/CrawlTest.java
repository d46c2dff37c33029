package org.netpreserve.fedicrawl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.netpreserve.fedicrawl.config.ConfigurationException;
import org.netpreserve.fedicrawl.config.CrawlerConfig;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@ExtendWith(InMemoryDatabaseTestExtension.class)
class CrawlTest {
    private final Database database;
    @TempDir
    Path tempDir;

    CrawlTest(Database database) {
        this.database = database;
    }

    private CrawlerConfig config(boolean checkpoints) throws IOException {
        return config(checkpoints, "0");
    }

    private CrawlerConfig config(boolean checkpoints, String healthCheckInterval) throws IOException {
        Path file = tempDir.resolve("config.yaml");
        Files.writeString(file, "proxies:\n  healthCheckInterval: " + healthCheckInterval + "\n" +
                                "checkpoint:\n  enabled: " + checkpoints + "\n  backupDir: " + tempDir.resolve("cp") + "\n" +
                                "output:\n  directory: " + tempDir.resolve("out") + "\n", StandardCharsets.UTF_8);
        return Fedicrawl.loadConfig(file, List.of());
    }

    @BeforeEach
    void setUp() {
        database.useHandle(handle -> handle.execute("DELETE FROM proxies"));
    }

    // crawls aren't closed here as that would close the shared database
    @Test
    void runWithoutSeedsFailsAndReturnsToStopped() throws IOException {
        var crawl = new Crawl(config(true), database);
        assertThrows(ConfigurationException.class, () -> crawl.run(false, null));
        assertEquals(Crawl.State.STOPPED, crawl.state());
        assertTrue(Files.isDirectory(tempDir.resolve("out")));
        assertNotNull(crawl.checkpoints());
    }

    @Test
    void healthChecksStopWhenRunEnds() throws IOException {
        var crawl = new Crawl(config(true, "1h"), database);
        assertFalse(crawl.healthChecksScheduled());
        for (int i = 0; i < 2; i++) {
            assertThrows(ConfigurationException.class, () -> crawl.run(false, null));
            assertFalse(crawl.healthChecksScheduled());
            assertEquals(Crawl.State.STOPPED, crawl.state());
        }
    }

    @Test
    void checkpointsUnavailableWhenDisabled() throws IOException {
        var crawl = new Crawl(config(false), database);
        assertThrows(ConfigurationException.class, crawl::checkpoints);
        assertEquals(0, crawl.proxyPool().stats().total());
    }
}
