package org.netpreserve.fedicrawl.api;

import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * One page of actor search results.
 */
public record SearchPage(List<Profile> actors, @Nullable String cursor, int dropped) {
    public SearchPage {
        actors = List.copyOf(actors);
    }
}
