package org.netpreserve.fedicrawl.dedup;

/**
 * Entity kinds deduplicated independently, each with its own filter.
 */
public enum Namespace {
    NODE, EDGE
}
