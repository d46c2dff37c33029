package org.netpreserve.fedicrawl.frontier;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static java.nio.file.StandardOpenOption.APPEND;
import static java.nio.file.StandardOpenOption.CREATE;

/**
 * Appends discovered nodes and edges to {@code nodes.jsonl} and {@code edges.jsonl}, one JSON object per line,
 * writing in batches.
 */
public class JsonLinesSink implements CrawlSink {
    private static final Logger log = LoggerFactory.getLogger(JsonLinesSink.class);
    public static final String NODES_FILE = "nodes.jsonl";
    public static final String EDGES_FILE = "edges.jsonl";

    private final ObjectMapper mapper = new ObjectMapper()
            .findAndRegisterModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);
    private final int batchSize;
    private final BufferedWriter nodesWriter;
    private final BufferedWriter edgesWriter;
    private final List<DiscoveredNode> nodes = new ArrayList<>();
    private final List<DiscoveredEdge> edges = new ArrayList<>();

    public JsonLinesSink(Path directory, int batchSize) throws IOException {
        this.batchSize = batchSize;
        Files.createDirectories(directory);
        this.nodesWriter = Files.newBufferedWriter(directory.resolve(NODES_FILE), StandardCharsets.UTF_8, CREATE, APPEND);
        this.edgesWriter = Files.newBufferedWriter(directory.resolve(EDGES_FILE), StandardCharsets.UTF_8, CREATE, APPEND);
    }

    @Override
    public synchronized void node(DiscoveredNode node) throws IOException {
        nodes.add(node);
        if (nodes.size() + edges.size() >= batchSize) flush();
    }

    @Override
    public synchronized void edge(DiscoveredEdge edge) throws IOException {
        edges.add(edge);
        if (nodes.size() + edges.size() >= batchSize) flush();
    }

    @Override
    public synchronized void flush() throws IOException {
        if (!nodes.isEmpty() || !edges.isEmpty()) {
            log.debug("Writing {} nodes and {} edges", nodes.size(), edges.size());
        }
        writeAll(nodesWriter, nodes);
        writeAll(edgesWriter, edges);
    }

    private void writeAll(BufferedWriter writer, List<?> batch) throws IOException {
        for (Object item : batch) {
            writer.write(mapper.writeValueAsString(item));
            writer.newLine();
        }
        batch.clear();
        writer.flush();
    }

    @Override
    public synchronized void close() throws IOException {
        try {
            flush();
        } finally {
            try {
                nodesWriter.close();
            } finally {
                edgesWriter.close();
            }
        }
    }
}
