package org.netpreserve.fedicrawl.frontier;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.fedicrawl.api.Profile;

import java.time.Instant;

/**
 * A newly discovered account with its provenance.
 *
 * @param depth    depth at which the account was discovered (seeds are depth 0)
 * @param strategy how it was discovered
 * @param via      handle of the account whose listing revealed it, null for seeds
 */
public record DiscoveredNode(Profile profile, int depth, String strategy, @Nullable String via, Instant discovered) {
}
