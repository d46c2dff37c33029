package org.netpreserve.fedicrawl.frontier;

import org.junit.jupiter.api.Test;
import org.netpreserve.fedicrawl.api.Direction;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FrontierStateTest {
    private static FrontierNode node(String name, Long followers) {
        return new FrontierNode("did:plc:" + name, name + ".test", followers, null);
    }

    @Test
    void nodeIsQueuedOnlyOnce() {
        var state = new FrontierState(2);
        assertTrue(state.enqueue(0, node("a", 10L)));
        assertFalse(state.enqueue(1, node("a", 10L)));
        assertEquals(1, state.pending());
        assertEquals(node("a", 10L), state.poll(0));
        assertTrue(state.markVisited("did:plc:a"));
        assertFalse(state.markVisited("did:plc:a"));
        assertFalse(state.enqueue(1, node("a", 10L)), "visited nodes are never queued again");
        assertTrue(state.isKnown("did:plc:a"));
        assertEquals(0, state.pending());
    }

    @Test
    void queuesAreFifo() {
        var state = new FrontierState(1);
        state.enqueue(1, node("b", null));
        state.enqueue(1, node("c", null));
        state.enqueue(1, node("d", null));
        assertEquals("did:plc:b", state.poll(1).id());
        assertEquals("did:plc:c", state.poll(1).id());
        assertEquals("did:plc:d", state.poll(1).id());
        assertNull(state.poll(1));
        assertFalse(state.hasPending(1));
    }

    @Test
    void depthMustBeInRange() {
        var state = new FrontierState(1);
        assertThrows(IllegalArgumentException.class, () -> state.enqueue(2, node("a", null)));
        assertThrows(IllegalArgumentException.class, () -> new FrontierState(-1));
    }

    @Test
    void advancingPastMaxDepthFails() {
        var state = new FrontierState(1);
        state.advanceDepth();
        assertEquals(1, state.currentDepth());
        assertThrows(IllegalStateException.class, state::advanceDepth);
    }

    @Test
    void snapshotRestoresQueuesVisitedAndCounters() throws IOException {
        var state = new FrontierState(2);
        state.enqueue(0, node("a", 5L));
        state.enqueue(0, node("b", null));
        state.poll(0);
        state.markVisited("did:plc:a");
        state.enqueue(1, node("c", 3L));
        state.enqueue(1, node("d", 7L));
        state.counters().nodeProcessed();
        state.counters().edgeEmitted();
        state.counters().edgeEmitted();
        state.counters().errors(3);

        FrontierState restored = FrontierState.fromBytes(state.toBytes());

        assertEquals(2, restored.maxDepth());
        assertEquals(0, restored.currentDepth());
        assertEquals(List.of(node("b", null)), restored.queue(0));
        assertEquals(List.of(node("c", 3L), node("d", 7L)), restored.queue(1));
        assertEquals(List.of(), restored.queue(2));
        assertTrue(restored.isVisited("did:plc:a"));
        assertEquals(3, restored.pending());
        assertEquals(1, restored.counters().nodesProcessed());
        assertEquals(2, restored.counters().edgesEmitted());
        assertEquals(3, restored.counters().errors());
        assertFalse(restored.enqueue(1, node("a", 5L)));
        assertFalse(restored.enqueue(2, node("c", 3L)));
    }

    @Test
    void inconsistentSnapshotIsRejected() {
        byte[] bytes = ("{\"maxDepth\":2,\"currentDepth\":0,\"queues\":[[]],\"visited\":[]," +
                        "\"counters\":{}}").getBytes(StandardCharsets.UTF_8);
        assertThrows(IOException.class, () -> FrontierState.fromBytes(bytes));
    }

    @Test
    void snapshotKeepsInterruptedNode() throws IOException {
        var state = new FrontierState(1);
        state.enqueue(0, node("a", 3L));
        FrontierNode a = state.poll(0);
        state.markVisited(a.id());
        state.progress(new NodeProgress(a, List.of(Direction.FOLLOWERS, Direction.FOLLOWS), "1", 1));

        FrontierState restored = FrontierState.fromBytes(state.toBytes());

        NodeProgress progress = restored.inProgress();
        assertNotNull(progress);
        assertEquals(a, progress.node());
        assertEquals(List.of(Direction.FOLLOWERS, Direction.FOLLOWS), progress.directions());
        assertEquals("1", progress.cursor());
        assertEquals(1, progress.fetched());
        assertEquals(0, restored.counters().nodesProcessed());

        restored.nodeFinished();
        assertNull(restored.inProgress());
        assertEquals(1, restored.counters().nodesProcessed());
    }

    @Test
    void interruptedNodeMustBeVisited() {
        byte[] bytes = ("{\"maxDepth\":0,\"currentDepth\":0,\"queues\":[[]],\"visited\":[],\"counters\":{}," +
                        "\"inProgress\":{\"node\":{\"id\":\"did:plc:a\"},\"directions\":[\"FOLLOWERS\"]," +
                        "\"cursor\":null,\"fetched\":0}}").getBytes(StandardCharsets.UTF_8);
        assertThrows(IOException.class, () -> FrontierState.fromBytes(bytes));
    }
}
