package org.netpreserve.fedicrawl.api;

import com.fasterxml.jackson.databind.JsonNode;
import org.jetbrains.annotations.Nullable;

/**
 * An account as returned by the upstream. Counts are only present in full profile views; listings omit them.
 */
public record Profile(
        String did,
        String handle,
        @Nullable String displayName,
        @Nullable Long followersCount,
        @Nullable Long followsCount,
        @Nullable Long postsCount) {

    public Profile {
        if (did == null || !did.startsWith("did:")) throw new IllegalArgumentException("Invalid DID: " + did);
        if (handle == null || handle.isBlank()) throw new IllegalArgumentException("Missing handle for " + did);
        requireNonNegative("followersCount", followersCount);
        requireNonNegative("followsCount", followsCount);
        requireNonNegative("postsCount", postsCount);
    }

    private static void requireNonNegative(String name, @Nullable Long value) {
        if (value != null && value < 0) throw new IllegalArgumentException("Negative " + name + ": " + value);
    }

    /**
     * Follower count for ordering, treating an unknown count as zero.
     */
    public long popularity() {
        return followersCount == null ? 0 : followersCount;
    }

    static Profile fromJson(JsonNode node) throws ValidationException {
        if (node == null || !node.isObject()) throw new ValidationException("Profile is not an object");
        try {
            return new Profile(text(node, "did"), text(node, "handle"), text(node, "displayName"),
                    count(node, "followersCount"), count(node, "followsCount"), count(node, "postsCount"));
        } catch (IllegalArgumentException e) {
            throw new ValidationException(e.getMessage(), e);
        }
    }

    @Nullable
    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || !value.isTextual() ? null : value.asText();
    }

    @Nullable
    private static Long count(JsonNode node, String field) throws ValidationException {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) return null;
        if (!value.canConvertToLong()) throw new ValidationException(field + " is not an integer: " + value);
        return value.asLong();
    }
}
