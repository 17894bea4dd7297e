package com.example.s3explorer.policy;

import com.example.s3explorer.AccessDeniedException;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Decides what a principal may read and write.
 *
 * <p>Admins are unrestricted. Every other role reads either everywhere or below its path prefix,
 * and writes only below the single shared write prefix. Prefix checks compare whole segments, so
 * {@code a/b} covers {@code a/b/c} but not {@code a/bc}.</p>
 */
public final class AccessPolicy {

    public static final String DELIMITER = "/";

    /**
     * Root of the key space; returned by {@link #effectivePrefixes(Principal)} for unrestricted principals.
     */
    public static final String UNRESTRICTED = "";

    private final String sharedWritePrefix;
    private final Map<Role, String> roleDefaultPrefixes;

    public AccessPolicy(String sharedWritePrefix) {
        this(sharedWritePrefix, Map.of());
    }

    public AccessPolicy(String sharedWritePrefix, Map<Role, String> roleDefaultPrefixes) {
        String normalized = folderPrefix(Objects.requireNonNull(sharedWritePrefix, "sharedWritePrefix"));
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException("sharedWritePrefix must not be the bucket root.");
        }
        this.sharedWritePrefix = normalized;
        Map<Role, String> defaults = new EnumMap<>(Role.class);
        if (roleDefaultPrefixes != null) {
            roleDefaultPrefixes.forEach((role, prefix) -> {
                if (role != Role.ADMIN && prefix != null && !prefix.isBlank()) {
                    defaults.put(role, prefix.trim());
                }
            });
        }
        this.roleDefaultPrefixes = defaults;
    }

    public String sharedWritePrefix() {
        return sharedWritePrefix;
    }

    public boolean canRead(Principal principal, String path) {
        Optional<String> restriction = readRestriction(principal);
        return restriction.isEmpty() || isUnder(path, restriction.get());
    }

    public boolean canWrite(Principal principal, String path) {
        if (principal.isAdmin()) {
            return true;
        }
        return isUnder(path, sharedWritePrefix);
    }

    public boolean hasPermission(Principal principal, Permission permission) {
        return principal.role().grants(permission);
    }

    /**
     * Folder prefixes the principal may browse, each ending in the delimiter. Never empty.
     */
    public Set<String> effectivePrefixes(Principal principal) {
        return readRestriction(principal)
                .map(prefix -> Set.of(folderPrefix(prefix)))
                .orElse(Set.of(UNRESTRICTED));
    }

    /**
     * Resolves the prefix a listing request should run against. A restricted principal asking for
     * the root is moved to its own prefix.
     *
     * @throws AccessDeniedException when the requested prefix lies outside the principal's scope
     */
    public String scopeListingPrefix(Principal principal, String requested) throws AccessDeniedException {
        String normalized = requested == null ? "" : stripLeadingDelimiters(requested.trim());
        Optional<String> restriction = readRestriction(principal);
        if (restriction.isEmpty()) {
            return normalized;
        }
        if (stripTrailingDelimiters(normalized).isEmpty()) {
            return folderPrefix(restriction.get());
        }
        if (!isUnder(normalized, restriction.get())) {
            throw new AccessDeniedException(normalized);
        }
        return normalized;
    }

    /**
     * Explicit prefix first, then the role default. Admins never have one.
     */
    public Optional<String> readRestriction(Principal principal) {
        if (principal.isAdmin()) {
            return Optional.empty();
        }
        Optional<String> explicit = principal.readRestriction();
        if (explicit.isPresent()) {
            return explicit;
        }
        return Optional.ofNullable(roleDefaultPrefixes.get(principal.role()));
    }

    public List<Permission> accessRules() {
        return List.of(Permission.values());
    }

    /**
     * Segment-wise prefix test: both sides are compared with exactly one trailing delimiter.
     */
    public static boolean isUnder(String path, String prefix) {
        String base = folderPrefix(prefix);
        if (base.isEmpty()) {
            return true;
        }
        String candidate = folderPrefix(path == null ? "" : path);
        return candidate.startsWith(base);
    }

    /**
     * Returns the prefix of the folder holding {@code key}; the root for top-level keys.
     */
    public static String containingPrefix(String key) {
        String trimmed = stripTrailingDelimiters(stripLeadingDelimiters(key == null ? "" : key.trim()));
        int slash = trimmed.lastIndexOf(DELIMITER);
        return slash < 0 ? UNRESTRICTED : trimmed.substring(0, slash + 1);
    }

    /**
     * {@code "a/b"}, {@code "/a/b//"} and {@code "a/b/"} all become {@code "a/b/"}; the root stays {@code ""}.
     */
    public static String folderPrefix(String path) {
        String trimmed = stripTrailingDelimiters(stripLeadingDelimiters(path.trim()));
        return trimmed.isEmpty() ? UNRESTRICTED : trimmed + DELIMITER;
    }

    static String stripTrailingDelimiters(String value) {
        int end = value.length();
        while (end > 0 && value.charAt(end - 1) == '/') {
            end--;
        }
        return value.substring(0, end);
    }

    static String stripLeadingDelimiters(String value) {
        int start = 0;
        while (start < value.length() && value.charAt(start) == '/') {
            start++;
        }
        return value.substring(start);
    }
}
