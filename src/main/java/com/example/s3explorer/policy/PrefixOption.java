package com.example.s3explorer.policy;

/**
 * A selectable path prefix for assigning read scope to users.
 */
public record PrefixOption(String value, String label) {

    /**
     * Builds an option labelled with the last segment of the prefix.
     */
    public static PrefixOption of(String prefix) {
        String value = AccessPolicy.stripTrailingDelimiters(prefix);
        int slash = value.lastIndexOf(AccessPolicy.DELIMITER);
        String label = slash < 0 ? value : value.substring(slash + 1);
        return new PrefixOption(value, label.isEmpty() ? value : label);
    }
}
