package com.example.s3explorer;

import com.example.s3explorer.policy.Principal;
import com.example.s3explorer.policy.Role;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public class ConfigLoader {
    private static final String DEFAULT_SHARED_WRITE_PREFIX = "dawarc/Circuler/";
    private static final int DEFAULT_PAGE_SIZE = 20;
    private static final int DEFAULT_MAX_KEYS = 1000;
    private static final int DEFAULT_MAX_LIST_ENTRIES = 10_000;
    private static final long DEFAULT_PRESIGN_EXPIRY_SECONDS = 3600;
    private static final long DEFAULT_MAX_UPLOAD_BYTES = 1_073_741_824L;
    private static final long DEFAULT_REQUEST_TIMEOUT_SECONDS = 30;
    private static final List<String> DEFAULT_CONTENT_TYPES = List.of(
            "image/jpeg",
            "image/png",
            "image/gif",
            "image/webp",
            "application/pdf",
            "video/mp4",
            "video/quicktime",
            "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet",
            "application/vnd.ms-excel"
    );
    private static final List<String> DEFAULT_NAMED_PREFIXES = List.of(
            "dawarc/circuit/ampere",
            "dawarc/circuit/hertz",
            "dawarc/circuit/joule",
            "dawarc/circuit/kelvin",
            "dawarc/circuit/pascal",
            "dawarc/circuit/tesla"
    );

    private final ObjectMapper mapper;

    public ConfigLoader() {
        mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public ExplorerConfig load(Path path) throws IOException {
        RawConfig raw = mapper.readValue(path.toFile(), RawConfig.class);

        if (raw.bucket == null || raw.bucket.isBlank()) {
            throw new IllegalArgumentException("Config must include a bucket.");
        }

        Optional<String> region = Optional.ofNullable(raw.region).filter(value -> !value.isBlank());
        Optional<URI> endpointOverride = Optional.ofNullable(raw.endpointOverride)
                .filter(value -> !value.isBlank())
                .map(URI::create);
        boolean pathStyleAccess = raw.pathStyleAccess != null && raw.pathStyleAccess;
        String sharedWritePrefix = normalizeFolder(optionalString(raw.sharedWritePrefix, DEFAULT_SHARED_WRITE_PREFIX));
        if (sharedWritePrefix.isEmpty()) {
            throw new IllegalArgumentException("sharedWritePrefix must name a folder below the bucket root.");
        }
        int pageSize = positiveOr(raw.pageSize, DEFAULT_PAGE_SIZE);
        int maxListEntries = positiveOr(raw.maxListEntries, DEFAULT_MAX_LIST_ENTRIES);
        int defaultMaxKeys = Math.min(positiveOr(raw.defaultMaxKeys, DEFAULT_MAX_KEYS), maxListEntries);
        Duration presignExpiry = Duration.ofSeconds(raw.presignExpirySeconds != null && raw.presignExpirySeconds > 0
                ? raw.presignExpirySeconds
                : DEFAULT_PRESIGN_EXPIRY_SECONDS);
        long maxUploadBytes = raw.maxUploadBytes != null && raw.maxUploadBytes > 0
                ? raw.maxUploadBytes
                : DEFAULT_MAX_UPLOAD_BYTES;

        List<String> allowedContentTypes = mergeDefaults(DEFAULT_CONTENT_TYPES, raw.allowedContentTypes);
        List<String> namedPathPrefixes = mergeDefaults(DEFAULT_NAMED_PREFIXES, raw.namedPathPrefixes);
        Map<Role, String> roleDefaultPrefixes = new EnumMap<>(Role.class);
        if (raw.roleDefaultPrefixes != null) {
            raw.roleDefaultPrefixes.forEach((role, prefix) -> {
                if (prefix != null && !prefix.isBlank()) {
                    roleDefaultPrefixes.put(Role.fromValue(role), prefix.trim());
                }
            });
        }

        Optional<Principal> principal = Optional.ofNullable(raw.principal).map(RawPrincipal::toPrincipal);
        Optional<URI> apiBaseUrl = Optional.ofNullable(raw.apiBaseUrl)
                .filter(value -> !value.isBlank())
                .map(value -> URI.create(value.endsWith("/") ? value : value + "/"));
        Path credentialFile = Optional.ofNullable(raw.credentialFile)
                .filter(value -> !value.isBlank())
                .map(Path::of)
                .orElseGet(() -> Path.of(System.getProperty("user.home"), ".s3-explorer", "credentials.json"));
        Duration requestTimeout = Duration.ofSeconds(raw.requestTimeoutSeconds != null && raw.requestTimeoutSeconds > 0
                ? raw.requestTimeoutSeconds
                : DEFAULT_REQUEST_TIMEOUT_SECONDS);

        return new ExplorerConfig(
                raw.bucket.trim(),
                region,
                endpointOverride,
                pathStyleAccess,
                sharedWritePrefix,
                pageSize,
                defaultMaxKeys,
                maxListEntries,
                presignExpiry,
                maxUploadBytes,
                allowedContentTypes,
                namedPathPrefixes,
                Map.copyOf(roleDefaultPrefixes),
                principal,
                apiBaseUrl,
                credentialFile,
                requestTimeout
        );
    }

    private List<String> mergeDefaults(List<String> defaults, List<String> overrides) {
        List<String> merged = new ArrayList<>(defaults);
        if (overrides != null) {
            for (String value : overrides) {
                if (value == null || value.isBlank() || merged.contains(value.trim())) {
                    continue;
                }
                merged.add(value.trim());
            }
        }
        return List.copyOf(merged);
    }

    private int positiveOr(Integer value, int fallback) {
        return value != null && value > 0 ? value : fallback;
    }

    private String normalizeFolder(String value) {
        String trimmed = value.trim().replaceAll("^/+", "").replaceAll("/+$", "");
        return trimmed.isEmpty() ? "" : trimmed + "/";
    }

    private String optionalString(String value, String fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        return value;
    }

    private static class RawConfig {
        public String bucket;
        public String region;
        public String endpointOverride;
        public Boolean pathStyleAccess;
        public String sharedWritePrefix;
        public Integer pageSize;
        public Integer defaultMaxKeys;
        public Integer maxListEntries;
        public Long presignExpirySeconds;
        public Long maxUploadBytes;
        public List<String> allowedContentTypes;
        public List<String> namedPathPrefixes;
        public Map<String, String> roleDefaultPrefixes = new LinkedHashMap<>();
        public RawPrincipal principal;
        public String apiBaseUrl;
        public String credentialFile;
        public Long requestTimeoutSeconds;
    }

    private static class RawPrincipal {
        public String id;
        public String role;
        public String allowedPathPrefix;

        Principal toPrincipal() {
            if (id == null || id.isBlank()) {
                throw new IllegalArgumentException("principal.id is required.");
            }
            return new Principal(id.trim(), Role.fromValue(role), allowedPathPrefix);
        }
    }
}
