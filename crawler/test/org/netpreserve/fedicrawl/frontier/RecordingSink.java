package org.netpreserve.fedicrawl.frontier;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

class RecordingSink implements CrawlSink {
    final List<DiscoveredNode> nodes = new ArrayList<>();
    final List<DiscoveredEdge> edges = new ArrayList<>();
    int flushes;
    boolean failOnEdge;

    @Override
    public void node(DiscoveredNode node) {
        nodes.add(node);
    }

    @Override
    public void edge(DiscoveredEdge edge) throws IOException {
        if (failOnEdge) throw new IOException("disk full");
        edges.add(edge);
    }

    @Override
    public void flush() {
        flushes++;
    }

    @Override
    public void close() {
    }
}
