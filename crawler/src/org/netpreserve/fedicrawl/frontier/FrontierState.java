package org.netpreserve.fedicrawl.frontier;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.*;

/**
 * The literal remaining work of a breadth-first crawl: one FIFO queue per depth, the set of nodes already visited,
 * the node whose listings were interrupted (if any), the depth being worked on and the session's counters.
 * <p>
 * A node id is in at most one queue at a time and, once visited, is never enqueued again.
 */
public class FrontierState {
    private static final ObjectMapper JSON = new ObjectMapper();
    private final int maxDepth;
    private final List<ArrayDeque<FrontierNode>> queues;
    private final Set<String> visited;
    private final Set<String> enqueued = new HashSet<>();
    private final CrawlCounters counters;
    private int currentDepth;
    @Nullable
    private NodeProgress inProgress;

    public FrontierState(int maxDepth) {
        this(maxDepth, 0, new LinkedHashSet<>(), new CrawlCounters());
    }

    private FrontierState(int maxDepth, int currentDepth, Set<String> visited, CrawlCounters counters) {
        if (maxDepth < 0) throw new IllegalArgumentException("maxDepth must not be negative");
        this.maxDepth = maxDepth;
        this.currentDepth = currentDepth;
        this.visited = visited;
        this.counters = counters;
        this.queues = new ArrayList<>(maxDepth + 1);
        for (int i = 0; i <= maxDepth; i++) {
            queues.add(new ArrayDeque<>());
        }
    }

    /**
     * Appends a node to a depth's queue unless it has been visited or is already queued.
     *
     * @return true if the node was added
     */
    public boolean enqueue(int depth, FrontierNode node) {
        if (depth < 0 || depth > maxDepth) throw new IllegalArgumentException("depth out of range: " + depth);
        if (visited.contains(node.id()) || !enqueued.add(node.id())) return false;
        queues.get(depth).add(node);
        return true;
    }

    public boolean isKnown(String id) {
        return visited.contains(id) || enqueued.contains(id);
    }

    @Nullable
    public FrontierNode poll(int depth) {
        FrontierNode node = queues.get(depth).poll();
        if (node != null) enqueued.remove(node.id());
        return node;
    }

    public boolean hasPending(int depth) {
        return !queues.get(depth).isEmpty();
    }

    /**
     * @return false if the node had already been visited
     */
    public boolean markVisited(String id) {
        return visited.add(id);
    }

    public boolean isVisited(String id) {
        return visited.contains(id);
    }

    public Set<String> visited() {
        return Collections.unmodifiableSet(visited);
    }

    public List<FrontierNode> queue(int depth) {
        return List.copyOf(queues.get(depth));
    }

    public int pending() {
        return enqueued.size();
    }

    @Nullable
    public NodeProgress inProgress() {
        return inProgress;
    }

    void progress(NodeProgress progress) {
        this.inProgress = progress;
    }

    /**
     * Clears the in-progress node and counts it as processed.
     */
    void nodeFinished() {
        inProgress = null;
        counters.nodeProcessed();
    }

    public int currentDepth() {
        return currentDepth;
    }

    void advanceDepth() {
        if (currentDepth >= maxDepth) throw new IllegalStateException("already at max depth");
        currentDepth++;
    }

    public int maxDepth() {
        return maxDepth;
    }

    public CrawlCounters counters() {
        return counters;
    }

    public byte[] toBytes() {
        var queueLists = new ArrayList<List<FrontierNode>>(queues.size());
        for (var queue : queues) {
            queueLists.add(new ArrayList<>(queue));
        }
        try {
            return JSON.writeValueAsBytes(new FrontierSnapshot(maxDepth, currentDepth, queueLists,
                    new ArrayList<>(visited), counters, inProgress));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static FrontierState fromBytes(byte[] bytes) throws IOException {
        FrontierSnapshot snapshot = JSON.readValue(bytes, FrontierSnapshot.class);
        if (snapshot.queues().size() != snapshot.maxDepth() + 1) {
            throw new IOException("Frontier snapshot has " + snapshot.queues().size() + " queues for max depth " +
                                  snapshot.maxDepth());
        }
        NodeProgress inProgress = snapshot.inProgress();
        if (inProgress != null && !snapshot.visited().contains(inProgress.node().id())) {
            throw new IOException("Frontier snapshot's in-progress node " + inProgress.node().id() +
                                  " is not marked visited");
        }
        var state = new FrontierState(snapshot.maxDepth(), snapshot.currentDepth(),
                new LinkedHashSet<>(snapshot.visited()), snapshot.counters());
        state.inProgress = inProgress;
        for (int depth = 0; depth < snapshot.queues().size(); depth++) {
            for (FrontierNode node : snapshot.queues().get(depth)) {
                state.enqueue(depth, node);
            }
        }
        return state;
    }
}
