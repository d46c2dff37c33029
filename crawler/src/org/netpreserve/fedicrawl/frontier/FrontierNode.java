package org.netpreserve.fedicrawl.frontier;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.fedicrawl.api.Direction;
import org.netpreserve.fedicrawl.api.Profile;

/**
 * A node waiting in the frontier. The counts, when known, cap how many edges are requested for it and order
 * freshly admitted nodes by popularity.
 */
public record FrontierNode(String id, @Nullable String handle, @Nullable Long followersCount,
                           @Nullable Long followsCount) {
    public static FrontierNode of(Profile profile) {
        return new FrontierNode(profile.did(), profile.handle(), profile.followersCount(), profile.followsCount());
    }

    public long popularity() {
        return followersCount == null ? 0 : followersCount;
    }

    @Nullable
    public Long edgeCount(Direction direction) {
        return direction == Direction.FOLLOWERS ? followersCount : followsCount;
    }

    public String label() {
        return handle != null ? handle : id;
    }
}
