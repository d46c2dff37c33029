package org.netpreserve.fedicrawl.frontier;

import com.fasterxml.jackson.annotation.JsonAutoDetect;

/**
 * Running totals of a crawl session, checkpointed along with the frontier.
 */
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY,
        getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE)
public class CrawlCounters {
    private long nodesProcessed;
    private long edgesEmitted;
    private long nodesDiscovered;
    private long duplicatesSkipped;
    private long errors;

    void nodeProcessed() {
        nodesProcessed++;
    }

    void edgeEmitted() {
        edgesEmitted++;
    }

    void nodeDiscovered() {
        nodesDiscovered++;
    }

    void duplicateSkipped() {
        duplicatesSkipped++;
    }

    void errors(long count) {
        errors += count;
    }

    public long nodesProcessed() {
        return nodesProcessed;
    }

    public long edgesEmitted() {
        return edgesEmitted;
    }

    public long nodesDiscovered() {
        return nodesDiscovered;
    }

    public long duplicatesSkipped() {
        return duplicatesSkipped;
    }

    public long errors() {
        return errors;
    }

    @Override
    public String toString() {
        return "nodes=" + nodesProcessed + " edges=" + edgesEmitted + " discovered=" + nodesDiscovered +
               " duplicates=" + duplicatesSkipped + " errors=" + errors;
    }
}
