package org.netpreserve.fedicrawl.frontier;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.netpreserve.fedicrawl.api.ApiException;
import org.netpreserve.fedicrawl.api.GraphSource;
import org.netpreserve.fedicrawl.api.Profile;
import org.netpreserve.fedicrawl.api.SearchPage;
import org.netpreserve.fedicrawl.config.TraversalConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Builds the depth-0 queue from explicit identifiers, an actor search, or the output of an earlier run.
 * Seeds are deduplicated by DID, optionally sorted by follower count and capped at {@code maxSeeds}.
 */
public class SeedLoader {
    private static final Logger log = LoggerFactory.getLogger(SeedLoader.class);
    private final ObjectMapper mapper = new ObjectMapper().findAndRegisterModules();
    private final GraphSource source;
    private final TraversalConfig config;

    public SeedLoader(GraphSource source, TraversalConfig config) {
        this.source = source;
        this.config = config;
    }

    /**
     * Resolves handles or DIDs through profile lookups. Identifiers that can't be resolved are skipped.
     */
    public List<Profile> fromIdentifiers(List<String> identifiers) throws InterruptedException {
        var profiles = new ArrayList<Profile>();
        for (String identifier : identifiers) {
            try {
                profiles.add(source.getProfile(identifier));
            } catch (ApiException e) {
                log.warn("Skipping seed {}: {}", identifier, e.getMessage());
            }
        }
        return finish(profiles, false);
    }

    /**
     * Seeds from actor search results, paging until {@code maxSeeds} profiles pass the follower threshold.
     */
    public List<Profile> fromSearch(String query) throws InterruptedException {
        var profiles = new ArrayList<Profile>();
        String cursor = null;
        do {
            SearchPage page;
            try {
                page = source.searchActors(query, cursor, 100);
            } catch (ApiException e) {
                log.warn("Seed search for '{}' stopped: {}", query, e.getMessage());
                break;
            }
            for (Profile profile : page.actors()) {
                if (passesThreshold(profile)) profiles.add(profile);
            }
            cursor = page.cursor();
        } while (cursor != null && profiles.size() < config.maxSeeds());
        return finish(profiles, true);
    }

    /**
     * Reads profiles from a JSON lines file written by an earlier run, keeping those above the follower threshold.
     * Lines may hold a bare profile or a discovered node wrapping one; malformed lines are skipped.
     */
    public List<Profile> fromDiscoveryFile(Path file) throws IOException {
        var profiles = new ArrayList<Profile>();
        int skipped = 0;
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isBlank()) continue;
                try {
                    JsonNode node = mapper.readTree(line);
                    if (node.has("profile")) node = node.get("profile");
                    Profile profile = mapper.treeToValue(node, Profile.class);
                    if (passesThreshold(profile)) profiles.add(profile);
                } catch (IOException | IllegalArgumentException e) {
                    skipped++;
                }
            }
        }
        if (skipped > 0) log.warn("Skipped {} malformed lines in {}", skipped, file);
        return finish(profiles, true);
    }

    private boolean passesThreshold(Profile profile) {
        return profile.followersCount() == null || profile.followersCount() >= config.minFollowerCount();
    }

    private List<Profile> finish(List<Profile> profiles, boolean filtered) {
        var unique = new LinkedHashMap<String, Profile>();
        for (Profile profile : profiles) {
            unique.putIfAbsent(profile.did(), profile);
        }
        var seeds = new ArrayList<>(unique.values());
        if (config.prioritizePopular()) {
            seeds.sort(Comparator.comparingLong(Profile::popularity).reversed());
        }
        if (seeds.size() > config.maxSeeds()) {
            seeds = new ArrayList<>(seeds.subList(0, config.maxSeeds()));
        }
        log.info("Loaded {} seeds{}", seeds.size(), filtered ? " (min followers " + config.minFollowerCount() + ")" : "");
        return seeds;
    }
}
