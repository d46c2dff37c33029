package org.netpreserve.fedicrawl.frontier;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.netpreserve.fedicrawl.api.Direction;
import org.netpreserve.fedicrawl.api.Profile;
import org.netpreserve.fedicrawl.config.TraversalConfig;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.netpreserve.fedicrawl.frontier.InMemoryGraph.did;

class SeedLoaderTest {
    private final InMemoryGraph graph = new InMemoryGraph()
            .account("alice", 10).account("bob", 200).account("carol", 3).account("dave", 50);

    private static TraversalConfig config(long minFollowerCount, boolean prioritizePopular, int maxSeeds) {
        return new TraversalConfig(2, null, null, 100, 100, minFollowerCount, prioritizePopular,
                EnumSet.of(Direction.FOLLOWERS), maxSeeds, null);
    }

    private static List<String> dids(List<Profile> profiles) {
        return profiles.stream().map(Profile::did).toList();
    }

    @Test
    void identifiersSkipUnresolvable() throws InterruptedException {
        var loader = new SeedLoader(graph, config(0, false, 10));
        List<Profile> seeds = loader.fromIdentifiers(List.of("alice.test", "nobody.test", did("bob"), "alice.test"));
        assertEquals(List.of(did("alice"), did("bob")), dids(seeds));
        assertEquals(10L, seeds.get(0).followersCount());
    }

    @Test
    void identifiersSortedByPopularityAndCapped() throws InterruptedException {
        var loader = new SeedLoader(graph, config(0, true, 2));
        List<Profile> seeds = loader.fromIdentifiers(List.of("alice", "bob", "carol", "dave"));
        assertEquals(List.of(did("bob"), did("dave")), dids(seeds));
    }

    @Test
    void searchAppliesThreshold() throws InterruptedException {
        var loader = new SeedLoader(graph, config(10, true, 10));
        List<Profile> seeds = loader.fromSearch("plc");
        assertEquals(List.of(did("bob"), did("dave"), did("alice")), dids(seeds));
        assertEquals(List.of("plc"), graph.searchCalls);
    }

    @Test
    void searchStopsPagingOnceEnoughSeeds() throws InterruptedException {
        var many = new InMemoryGraph();
        for (int i = 0; i < 250; i++) many.account("user" + i, i);
        var loader = new SeedLoader(many, config(0, false, 120));
        List<Profile> seeds = loader.fromSearch("user");
        assertEquals(120, seeds.size());
        assertEquals(2, many.searchCalls.size());
    }

    @Test
    void discoveryFileAcceptsBareAndWrappedProfiles(@TempDir Path tempDir) throws IOException {
        Path file = tempDir.resolve("nodes.jsonl");
        Files.write(file, List.of(
                "{\"did\":\"did:plc:alice\",\"handle\":\"alice.test\",\"followersCount\":10}",
                "{\"profile\":{\"did\":\"did:plc:bob\",\"handle\":\"bob.test\",\"followersCount\":200}," +
                "\"depth\":1,\"strategy\":\"relationships\",\"via\":\"alice.test\"}",
                "",
                "not json",
                "{\"did\":\"not-a-did\",\"handle\":\"x.test\"}",
                "{\"did\":\"did:plc:carol\",\"handle\":\"carol.test\",\"followersCount\":3}",
                "{\"did\":\"did:plc:alice\",\"handle\":\"alice.test\",\"followersCount\":10}",
                "{\"did\":\"did:plc:erin\",\"handle\":\"erin.test\"}"), StandardCharsets.UTF_8);

        var loader = new SeedLoader(graph, config(5, true, 10));
        List<Profile> seeds = loader.fromDiscoveryFile(file);

        assertEquals(List.of(did("bob"), did("alice"), "did:plc:erin"), dids(seeds));
    }
}
