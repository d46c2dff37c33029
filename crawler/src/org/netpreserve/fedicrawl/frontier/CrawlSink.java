package org.netpreserve.fedicrawl.frontier;

import java.io.Closeable;
import java.io.IOException;

/**
 * Receives discovered nodes and edges. Implementations may buffer until {@link #flush()}.
 */
public interface CrawlSink extends Closeable {
    void node(DiscoveredNode node) throws IOException;

    void edge(DiscoveredEdge edge) throws IOException;

    void flush() throws IOException;
}
