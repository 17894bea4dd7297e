package com.example.s3explorer.gateway;

import com.example.s3explorer.StorageException;
import com.example.s3explorer.gateway.MutationResult.Outcome;
import com.example.s3explorer.policy.AccessPolicy;
import com.example.s3explorer.policy.Permission;
import com.example.s3explorer.policy.Principal;
import com.example.s3explorer.storage.ObjectStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Validates and executes writes. Authorization is checked before storage is touched, so a denied
 * request has no side effects. Nothing here is retried; retry policy belongs to the caller.
 */
public final class MutationGateway {
    private static final Logger LOGGER = LoggerFactory.getLogger(MutationGateway.class);
    private static final String DELIMITER = AccessPolicy.DELIMITER;

    private final ObjectStorage storage;
    private final AccessPolicy policy;
    private final ContentTypeDetector contentTypes;
    private final Set<String> allowedContentTypes;
    private final long maxUploadBytes;

    public MutationGateway(ObjectStorage storage,
                           AccessPolicy policy,
                           ContentTypeDetector contentTypes,
                           List<String> allowedContentTypes,
                           long maxUploadBytes) {
        this.storage = Objects.requireNonNull(storage, "storage");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.contentTypes = Objects.requireNonNull(contentTypes, "contentTypes");
        this.allowedContentTypes = Set.copyOf(allowedContentTypes);
        this.maxUploadBytes = maxUploadBytes;
    }

    /**
     * Uploads {@code fileName} into {@code folder}. A blank folder means the shared write area.
     */
    public MutationResult upload(Principal principal, String folder, String fileName, byte[] fileBytes) {
        if (fileName == null || fileName.isBlank() || fileName.contains(DELIMITER) || isTraversal(fileName.trim())) {
            return MutationResult.failure(Outcome.INVALID, fileName, "Invalid file name");
        }
        String target = folder == null || folder.isBlank()
                ? policy.sharedWritePrefix()
                : AccessPolicy.folderPrefix(folder);
        return upload(principal, target + fileName.trim(), fileBytes);
    }

    /**
     * Uploads {@code fileBytes} to the object key {@code targetPath}.
     */
    public MutationResult upload(Principal principal, String targetPath, byte[] fileBytes) {
        if (!policy.hasPermission(principal, Permission.FILES_WRITE)) {
            return denied(principal, targetPath, "Permission denied: " + Permission.FILES_WRITE.id());
        }
        String key = targetPath == null ? "" : stripLeading(targetPath.trim());
        if (key.isEmpty() || key.endsWith(DELIMITER) || hasTraversal(key)) {
            return MutationResult.failure(Outcome.INVALID, targetPath, "Invalid upload path");
        }
        if (!policy.canWrite(principal, key)) {
            return denied(principal, key, "Access denied to this path");
        }
        if (fileBytes == null) {
            return MutationResult.failure(Outcome.INVALID, key, "File content is required");
        }
        if (fileBytes.length > maxUploadBytes) {
            return MutationResult.failure(Outcome.TOO_LARGE, key, "File exceeds " + maxUploadBytes + " bytes");
        }
        String contentType = contentTypes.detect(fileName(key), fileBytes);
        if (!allowedContentTypes.contains(contentType)) {
            return MutationResult.failure(Outcome.UNSUPPORTED_MEDIA_TYPE, key, "File type not allowed: " + contentType);
        }
        try {
            storage.put(key, fileBytes, contentType);
        } catch (StorageException ex) {
            LOGGER.warn("Upload of {} by {} failed", key, principal.id(), ex);
            return MutationResult.failure(Outcome.UPLOAD_FAILED, key, "Upload failed");
        }
        LOGGER.info("{} uploaded {} ({} bytes, {})", principal.id(), key, fileBytes.length, contentType);
        return MutationResult.success(key, "File uploaded");
    }

    /**
     * Creates the folder marker for {@code targetPath}. Creating a folder that already exists
     * succeeds without writing.
     */
    public MutationResult createFolder(Principal principal, String targetPath) {
        if (!policy.hasPermission(principal, Permission.FILES_WRITE)) {
            return denied(principal, targetPath, "Permission denied: " + Permission.FILES_WRITE.id());
        }
        String key = targetPath == null ? "" : AccessPolicy.folderPrefix(targetPath);
        if (key.isEmpty() || hasTraversal(key) || key.contains(DELIMITER + DELIMITER)) {
            return MutationResult.failure(Outcome.INVALID, targetPath, "Invalid folder path");
        }
        if (!policy.canWrite(principal, key)) {
            return denied(principal, key, "Access denied to this path");
        }
        try {
            if (storage.exists(key)) {
                LOGGER.debug("Folder {} already exists", key);
                return MutationResult.unchanged(key, "Folder already exists");
            }
            storage.putMarker(key);
        } catch (StorageException ex) {
            LOGGER.warn("Creating folder {} for {} failed", key, principal.id(), ex);
            return MutationResult.failure(Outcome.FAILED, key, "Failed to create folder");
        }
        LOGGER.info("{} created folder {}", principal.id(), key);
        return MutationResult.success(key, "Folder created");
    }

    /**
     * Creates folder {@code name} directly below the shared write area.
     */
    public MutationResult createSharedFolder(Principal principal, String name) {
        if (name == null || name.isBlank() || isTraversal(name.trim())) {
            return MutationResult.failure(Outcome.INVALID, name, "Invalid folder name");
        }
        return createFolder(principal, policy.sharedWritePrefix() + stripLeading(name.trim()));
    }

    public MutationResult delete(Principal principal, String key) {
        if (!policy.hasPermission(principal, Permission.FILES_DELETE)) {
            return denied(principal, key, "Permission denied: " + Permission.FILES_DELETE.id());
        }
        String normalized = key == null ? "" : stripLeading(key.trim());
        if (normalized.isEmpty() || hasTraversal(normalized)) {
            return MutationResult.failure(Outcome.INVALID, key, "Missing key");
        }
        if (!policy.canWrite(principal, normalized)) {
            return denied(principal, normalized, "Access denied to this path");
        }
        try {
            if (!storage.exists(normalized)) {
                return MutationResult.failure(Outcome.NOT_FOUND, normalized, "File not found");
            }
            storage.delete(normalized);
        } catch (StorageException ex) {
            LOGGER.warn("Deleting {} for {} failed", normalized, principal.id(), ex);
            return MutationResult.failure(Outcome.FAILED, normalized, "Delete failed");
        }
        LOGGER.info("{} deleted {}", principal.id(), normalized);
        return MutationResult.success(normalized, "File deleted");
    }

    private MutationResult denied(Principal principal, String key, String message) {
        LOGGER.warn("Denied write of {} for {} ({})", key, principal.id(), principal.role().value());
        return MutationResult.failure(Outcome.DENIED, key, message);
    }

    private static boolean hasTraversal(String key) {
        for (String segment : key.split(DELIMITER)) {
            if (isTraversal(segment)) {
                return true;
            }
        }
        return false;
    }

    private static boolean isTraversal(String segment) {
        return segment.equals("..") || segment.equals(".");
    }

    private static String fileName(String key) {
        int slash = key.lastIndexOf(DELIMITER);
        return slash < 0 ? key : key.substring(slash + 1);
    }

    private static String stripLeading(String value) {
        int start = 0;
        while (start < value.length() && value.charAt(start) == '/') {
            start++;
        }
        return value.substring(start);
    }
}
