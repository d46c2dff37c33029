package org.netpreserve.fedicrawl.api;

import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * One page of a follower or following listing.
 *
 * @param profiles the accounts on the other end of each edge, malformed entries removed
 * @param cursor   token for the next page, null at the end of the listing
 * @param dropped  number of malformed entries removed
 */
public record EdgePage(List<Profile> profiles, @Nullable String cursor, int dropped) {
    public EdgePage {
        profiles = List.copyOf(profiles);
    }
}
