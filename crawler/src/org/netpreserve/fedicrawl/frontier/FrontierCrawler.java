package org.netpreserve.fedicrawl.frontier;

import com.fasterxml.uuid.Generators;
import org.jetbrains.annotations.Nullable;
import org.netpreserve.fedicrawl.api.*;
import org.netpreserve.fedicrawl.checkpoint.Checkpoint;
import org.netpreserve.fedicrawl.checkpoint.CheckpointMetadata;
import org.netpreserve.fedicrawl.checkpoint.CheckpointStore;
import org.netpreserve.fedicrawl.config.TraversalConfig;
import org.netpreserve.fedicrawl.dedup.Deduplicator;
import org.netpreserve.fedicrawl.dedup.Namespace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;

import static org.netpreserve.fedicrawl.frontier.CrawlResult.Status.*;

/**
 * Depth-bounded breadth-first traversal of the follow graph.
 * <p>
 * Depths are worked strictly in order and each depth's queue FIFO. A node is marked visited before its listings
 * are fetched, so its edges are requested at most once per session. Each edge is emitted at most once; the far
 * end of every edge found at a depth below the maximum is enqueued one level deeper if it has enough followers
 * and isn't already visited or queued. Each batch of newly admitted nodes can be sorted by follower count first.
 * <p>
 * Cancellation is checked before each node and each page. The crawl stops after the page in flight, flushes the
 * sink and writes a final checkpoint holding the complete frontier, including the listing position of a node it
 * stopped partway through, so a later run resumes exactly where this one stopped. A node only counts as processed
 * once all its listings are fetched.
 */
public class FrontierCrawler {
    private static final Logger log = LoggerFactory.getLogger(FrontierCrawler.class);
    public static final String SCRAPER_TYPE = "relationships";

    private final GraphSource source;
    private final Deduplicator dedup;
    @Nullable
    private final CheckpointStore checkpoints;
    private final CrawlSink sink;
    private final TraversalConfig config;
    private final int pageSize;
    private final int checkpointInterval;
    private final Clock clock;
    private volatile boolean cancelled;

    /**
     * @param checkpoints        where to checkpoint, or null to run without checkpoints
     * @param checkpointInterval processed nodes between periodic checkpoints
     */
    public FrontierCrawler(GraphSource source, Deduplicator dedup, @Nullable CheckpointStore checkpoints,
                           CrawlSink sink, TraversalConfig config, int pageSize, int checkpointInterval, Clock clock) {
        this.source = source;
        this.dedup = dedup;
        this.checkpoints = checkpoints;
        this.sink = sink;
        this.config = config;
        this.pageSize = pageSize;
        this.checkpointInterval = checkpointInterval;
        this.clock = clock;
    }

    /**
     * Asks a running crawl to stop at the next node or page boundary.
     */
    public void cancel() {
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    /**
     * Runs the crawl until the frontier is exhausted, a budget is reached or it is cancelled.
     *
     * @param seeds  depth-0 nodes, ignored when resuming
     * @param resume continue from the latest unfinished checkpoint, if there is one
     * @throws IOException if output can't be written; no final checkpoint is taken in that case
     */
    public CrawlResult run(List<Profile> seeds, boolean resume) throws IOException {
        Instant start = clock.instant();
        FrontierState state = null;
        String sessionId = null;
        if (resume) {
            Checkpoint checkpoint = resumableCheckpoint();
            if (checkpoint != null) {
                state = FrontierState.fromBytes(checkpoint.state());
                sessionId = checkpoint.sessionId();
                log.atInfo().addKeyValue("checkpoint", checkpoint.id())
                        .addKeyValue("session", sessionId)
                        .addKeyValue("depth", state.currentDepth())
                        .addKeyValue("pending", state.pending())
                        .addKeyValue("visited", state.visited().size())
                        .log("Resuming crawl");
            }
        }
        if (state == null) {
            state = new FrontierState(config.maxDepth());
            sessionId = Generators.timeBasedEpochGenerator().generate().toString();
            for (Profile seed : seeds) {
                if (state.enqueue(0, FrontierNode.of(seed))) {
                    emitNode(state, seed, 0, null);
                }
            }
            log.atInfo().addKeyValue("session", sessionId).addKeyValue("seeds", state.pending())
                    .log("Starting crawl");
        }

        boolean interrupted = false;
        CrawlResult.Status status;
        try {
            status = traverse(state, sessionId);
        } catch (InterruptedException e) {
            interrupted = true;
            status = CANCELLED;
        }

        sink.flush();
        String checkpointId = checkpoint(state, sessionId, status);
        if (interrupted) Thread.currentThread().interrupt();

        CrawlCounters counters = state.counters();
        var result = new CrawlResult(sessionId, status, counters.nodesProcessed(), counters.edgesEmitted(),
                counters.nodesDiscovered(), counters.duplicatesSkipped(), counters.errors(),
                Duration.between(start, clock.instant()), state.currentDepth(), checkpointId);
        log.atInfo().addKeyValue("status", status.label())
                .addKeyValue("depth", result.finalDepth())
                .addKeyValue("elapsed", result.elapsed())
                .log("Crawl finished: {}", counters);
        return result;
    }

    /**
     * Whether {@code run(seeds, true)} would continue an earlier session rather than start from the seeds.
     */
    public boolean canResume() {
        return resumableCheckpoint() != null;
    }

    @Nullable
    private Checkpoint resumableCheckpoint() {
        if (checkpoints == null) return null;
        Checkpoint checkpoint = checkpoints.loadLatest(SCRAPER_TYPE).orElse(null);
        if (checkpoint == null) return null;
        if (COMPLETED.label().equals(checkpoint.status())) {
            log.info("Latest checkpoint {} is of a completed crawl, starting afresh", checkpoint.id());
            return null;
        }
        return checkpoint;
    }

    private CrawlResult.Status traverse(FrontierState state, String sessionId)
            throws InterruptedException, IOException {
        int sinceCheckpoint = 0;
        while (true) {
            int depth = state.currentDepth();
            while (state.inProgress() != null || state.hasPending(depth)) {
                if (cancelled || Thread.currentThread().isInterrupted()) return CANCELLED;
                if (budgetReached(state)) return BUDGET_EXHAUSTED;
                NodeProgress progress = state.inProgress();
                if (progress == null) {
                    FrontierNode node = state.poll(depth);
                    if (node == null || !state.markVisited(node.id())) continue;
                    progress = NodeProgress.start(node, config.directions());
                } else {
                    log.atInfo().addKeyValue("node", progress.node().label())
                            .addKeyValue("direction", progress.directions().get(0))
                            .addKeyValue("fetched", progress.fetched())
                            .log("Continuing interrupted node");
                }
                if (!processNode(state, progress, depth)) {
                    return cancelled ? CANCELLED : BUDGET_EXHAUSTED;
                }
                state.nodeFinished();
                if (checkpoints != null && ++sinceCheckpoint >= checkpointInterval) {
                    sink.flush();
                    checkpoint(state, sessionId, RUNNING);
                    sinceCheckpoint = 0;
                }
            }
            if (depth >= state.maxDepth()) return COMPLETED;
            log.atInfo().addKeyValue("depth", depth + 1)
                    .addKeyValue("pending", state.queue(depth + 1).size())
                    .log("Advancing to next depth");
            state.advanceDepth();
        }
    }

    /**
     * Fetches a node's listings from where its progress stands. The state's in-progress record is kept pointing at
     * the next page to fetch, so a crawl stopped partway through the node picks up there.
     *
     * @return false if cancellation or the edge budget stopped it before all listings were fetched
     */
    private boolean processNode(FrontierState state, NodeProgress progress, int depth)
            throws InterruptedException, IOException {
        FrontierNode node = progress.node();
        List<Direction> directions = progress.directions();
        String cursor = progress.cursor();
        int fetched = progress.fetched();
        for (int i = 0; i < directions.size(); i++) {
            Direction direction = directions.get(i);
            List<Direction> remaining = directions.subList(i, directions.size());
            int cap = config.maxEdgesPerNode(direction);
            Long known = node.edgeCount(direction);
            if (known != null) cap = (int) Math.min(cap, known);
            while (fetched < cap) {
                state.progress(new NodeProgress(node, remaining, cursor, fetched));
                if (cancelled) return false;
                EdgePage page;
                try {
                    page = source.listEdges(node.id(), direction, cursor, Math.min(pageSize, cap - fetched));
                } catch (ApiException e) {
                    state.counters().errors(1);
                    log.atWarn().addKeyValue("node", node.label())
                            .addKeyValue("direction", direction)
                            .log("Giving up on listing: {}", e.getMessage());
                    break;
                }
                if (page.dropped() > 0) state.counters().errors(page.dropped());
                List<Profile> profiles = page.profiles();
                if (profiles.size() > cap - fetched) profiles = profiles.subList(0, cap - fetched);
                // the page is fetched again on resume; its edges already emitted are skipped as duplicates
                if (handlePage(state, node, depth, direction, profiles)) return false;
                fetched += profiles.size();
                cursor = page.cursor();
                if (cursor == null || page.profiles().isEmpty()) break;
            }
            cursor = null;
            fetched = 0;
        }
        return true;
    }

    /**
     * @return true if the edge budget was reached partway through the page
     */
    private boolean handlePage(FrontierState state, FrontierNode node, int depth, Direction direction,
                               List<Profile> profiles) throws IOException {
        var admitted = new ArrayList<FrontierNode>();
        Set<String> seen = new HashSet<>();
        for (Profile profile : profiles) {
            if (edgeBudgetReached(state)) {
                enqueueAll(state, depth + 1, admitted);
                return true;
            }
            String source = direction == Direction.FOLLOWERS ? profile.did() : node.id();
            String target = direction == Direction.FOLLOWERS ? node.id() : profile.did();
            String edgeKey = Deduplicator.edgeKey(source, target, direction.name());
            if (dedup.isDuplicate(edgeKey, Namespace.EDGE)) {
                state.counters().duplicateSkipped();
            } else {
                sink.edge(new DiscoveredEdge(source, target, direction, depth, SCRAPER_TYPE, clock.instant()));
                dedup.markProcessed(edgeKey, Namespace.EDGE, provenance(node.label(), depth));
                state.counters().edgeEmitted();
            }
            emitNode(state, profile, depth + 1, node.label());
            if (depth < state.maxDepth() && admits(profile) && !state.isKnown(profile.did())
                && seen.add(profile.did())) {
                admitted.add(FrontierNode.of(profile));
            }
        }
        enqueueAll(state, depth + 1, admitted);
        return false;
    }

    private void enqueueAll(FrontierState state, int depth, List<FrontierNode> admitted) {
        if (admitted.isEmpty() || depth > state.maxDepth()) return;
        if (config.prioritizePopular()) {
            admitted.sort(Comparator.comparingLong(FrontierNode::popularity).reversed());
        }
        for (FrontierNode node : admitted) {
            state.enqueue(depth, node);
        }
    }

    /**
     * Nodes with an unknown follower count are admitted, since listings don't report counts.
     */
    private boolean admits(Profile profile) {
        return profile.followersCount() == null || profile.followersCount() >= config.minFollowerCount();
    }

    private void emitNode(FrontierState state, Profile profile, int depth, @Nullable String via) throws IOException {
        if (dedup.isDuplicate(profile.did(), Namespace.NODE)) return;
        sink.node(new DiscoveredNode(profile, depth, SCRAPER_TYPE, via, clock.instant()));
        dedup.markProcessed(profile.did(), Namespace.NODE, provenance(via, depth));
        state.counters().nodeDiscovered();
    }

    private static Map<String, String> provenance(@Nullable String via, int depth) {
        var metadata = new LinkedHashMap<String, String>();
        metadata.put("strategy", SCRAPER_TYPE);
        metadata.put("depth", String.valueOf(depth));
        if (via != null) metadata.put("source", via);
        return metadata;
    }

    private boolean budgetReached(FrontierState state) {
        return (config.maxNodes() != null && state.counters().nodesProcessed() >= config.maxNodes())
               || edgeBudgetReached(state);
    }

    private boolean edgeBudgetReached(FrontierState state) {
        return config.maxEdges() != null && state.counters().edgesEmitted() >= config.maxEdges();
    }

    @Nullable
    private String checkpoint(FrontierState state, String sessionId, CrawlResult.Status status) {
        dedup.saveFilters();
        if (checkpoints == null) return null;
        var metadata = new LinkedHashMap<String, String>();
        metadata.put(CheckpointMetadata.STATUS, status.label());
        metadata.put("depth", String.valueOf(state.currentDepth()));
        metadata.put("nodesProcessed", String.valueOf(state.counters().nodesProcessed()));
        metadata.put("edgesEmitted", String.valueOf(state.counters().edgesEmitted()));
        metadata.put("pending", String.valueOf(state.pending()));
        NodeProgress inProgress = state.inProgress();
        if (inProgress != null) metadata.put("inProgress", inProgress.node().id());
        return checkpoints.save(SCRAPER_TYPE, sessionId, state.toBytes(), new CheckpointMetadata(metadata));
    }
}
