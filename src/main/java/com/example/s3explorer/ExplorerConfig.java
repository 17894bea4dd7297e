package com.example.s3explorer;

import com.example.s3explorer.policy.Principal;
import com.example.s3explorer.policy.Role;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable runtime settings for the explorer.
 */
public record ExplorerConfig(
        String bucket,
        Optional<String> region,
        Optional<URI> endpointOverride,
        boolean pathStyleAccess,
        String sharedWritePrefix,
        int pageSize,
        int defaultMaxKeys,
        int maxListEntries,
        Duration presignExpiry,
        long maxUploadBytes,
        List<String> allowedContentTypes,
        List<String> namedPathPrefixes,
        Map<Role, String> roleDefaultPrefixes,
        Optional<Principal> principal,
        Optional<URI> apiBaseUrl,
        Path credentialFile,
        Duration requestTimeout
) {
}
