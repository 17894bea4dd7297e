package com.example.s3explorer;

import com.example.s3explorer.gateway.MutationGateway;
import com.example.s3explorer.gateway.MutationResult;
import com.example.s3explorer.policy.AccessPolicy;
import com.example.s3explorer.policy.Permission;
import com.example.s3explorer.policy.PrefixCatalog;
import com.example.s3explorer.policy.PrefixOption;
import com.example.s3explorer.policy.Principal;
import com.example.s3explorer.storage.ObjectStorage;
import com.example.s3explorer.tree.Breadcrumb;
import com.example.s3explorer.tree.Page;
import com.example.s3explorer.tree.PageCursor;
import com.example.s3explorer.tree.RawListing;
import com.example.s3explorer.tree.TreeListing;
import com.example.s3explorer.tree.TreeNode;
import com.example.s3explorer.tree.VirtualTreeTranslator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Client-facing operations: browse, download links, uploads and folder creation. Every read is
 * authorized against the caller's read scope before storage is queried; writes go through the
 * {@link MutationGateway}.
 */
public final class ExplorerService {
    private static final Logger LOGGER = LoggerFactory.getLogger(ExplorerService.class);
    private static final Duration MAX_PRESIGN_EXPIRY = Duration.ofDays(7);
    private static final int DISCOVERY_MAX_KEYS = 500;

    private final ObjectStorage storage;
    private final AccessPolicy policy;
    private final VirtualTreeTranslator translator;
    private final MutationGateway gateway;
    private final ExplorerConfig config;

    public ExplorerService(ObjectStorage storage,
                           AccessPolicy policy,
                           VirtualTreeTranslator translator,
                           MutationGateway gateway,
                           ExplorerConfig config) {
        this.storage = Objects.requireNonNull(storage, "storage");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.translator = Objects.requireNonNull(translator, "translator");
        this.gateway = Objects.requireNonNull(gateway, "gateway");
        this.config = Objects.requireNonNull(config, "config");
    }

    /**
     * Lists the folders and files directly under {@code prefix}. A prefix with nothing under it
     * lists as empty.
     *
     * @param maxKeys entries to fetch, {@code null} for the configured default; capped at the
     *                configured response limit
     */
    public TreeListing tree(Principal principal, String prefix, Integer maxKeys)
            throws AccessDeniedException, StorageException {
        requirePermission(principal, Permission.FILES_READ);
        String scoped = policy.scopeListingPrefix(principal, prefix);
        if (!policy.canRead(principal, scoped)) {
            throw new AccessDeniedException(scoped);
        }
        String listPrefix = AccessPolicy.folderPrefix(scoped);
        int limit = maxKeys == null || maxKeys <= 0
                ? config.defaultMaxKeys()
                : Math.min(maxKeys, config.maxListEntries());
        RawListing raw = storage.list(listPrefix, AccessPolicy.DELIMITER, limit);
        TreeListing listing = translator.listChildren(listPrefix, raw);
        LOGGER.debug("{} listed '{}' ({} entries)", principal.id(), listPrefix, listing.nodes().size());
        return listing;
    }

    /**
     * One page of the merged folders-then-files listing for the cursor's prefix.
     */
    public Page<TreeNode> page(Principal principal, PageCursor cursor) throws AccessDeniedException, StorageException {
        TreeListing listing = tree(principal, cursor.prefix(), null);
        return translator.paginate(listing, cursor);
    }

    /**
     * Lists {@code pageNumber} of {@code prefix} with breadcrumbs for the folder actually shown. A
     * restricted principal asking for the root gets its own prefix, and the breadcrumbs follow it.
     */
    public FolderView browse(Principal principal, String prefix, int pageNumber)
            throws AccessDeniedException, StorageException {
        TreeListing listing = tree(principal, prefix, null);
        PageCursor cursor = firstPage(listing.prefix()).withPage(pageNumber);
        return new FolderView(listing.prefix(), breadcrumbs(listing.prefix()), translator.paginate(listing, cursor));
    }

    public PageCursor firstPage(String prefix) {
        return PageCursor.first(prefix, config.pageSize());
    }

    public List<Breadcrumb> breadcrumbs(String prefix) {
        return translator.breadcrumbs(prefix);
    }

    /**
     * Issues a temporary download link for {@code key}.
     *
     * @param expiresIn link lifetime, {@code null} for the configured default
     * @throws ObjectNotFoundException when the key does not exist
     */
    public PresignedUrl downloadUrl(Principal principal, String key, Duration expiresIn)
            throws AccessDeniedException, ObjectNotFoundException, StorageException {
        requirePermission(principal, Permission.FILES_READ);
        if (key == null || key.isBlank() || key.endsWith(AccessPolicy.DELIMITER)) {
            throw new IllegalArgumentException("Missing key");
        }
        Duration lifetime = expiresIn == null ? config.presignExpiry() : expiresIn;
        if (lifetime.isZero() || lifetime.isNegative() || lifetime.compareTo(MAX_PRESIGN_EXPIRY) > 0) {
            throw new IllegalArgumentException("expiresIn must be between 1 second and 7 days");
        }
        String normalized = key.trim().replaceAll("^/+", "");
        if (!policy.canRead(principal, AccessPolicy.containingPrefix(normalized))) {
            throw new AccessDeniedException(normalized);
        }
        if (!storage.exists(normalized)) {
            throw new ObjectNotFoundException(normalized);
        }
        String url = storage.presignGet(normalized, lifetime).toString();
        return new PresignedUrl(url, lifetime.getSeconds());
    }

    public MutationResult upload(Principal principal, String folder, String fileName, byte[] content) {
        return gateway.upload(principal, folder, fileName, content);
    }

    public MutationResult createFolder(Principal principal, String path) {
        return gateway.createFolder(principal, path);
    }

    public MutationResult delete(Principal principal, String key) {
        return gateway.delete(principal, key);
    }

    public Set<String> effectivePrefixes(Principal principal) {
        return policy.effectivePrefixes(principal);
    }

    /**
     * Prefix options for assigning read scope: configured names first, then the top-level folders
     * found in storage. Administrators only.
     */
    public List<PrefixOption> pathPrefixes(Principal principal) throws AccessDeniedException, StorageException {
        if (!principal.isAdmin()) {
            throw new AccessDeniedException("Role required: admin", AccessPolicy.UNRESTRICTED);
        }
        RawListing root = storage.list(AccessPolicy.UNRESTRICTED, AccessPolicy.DELIMITER, DISCOVERY_MAX_KEYS);
        List<PrefixOption> discovered = new ArrayList<>();
        for (TreeNode folder : translator.listChildren(AccessPolicy.UNRESTRICTED, root).folders()) {
            discovered.add(PrefixOption.of(folder.key()));
        }
        return PrefixCatalog.merge(PrefixCatalog.fromPrefixes(config.namedPathPrefixes()), discovered);
    }

    private void requirePermission(Principal principal, Permission permission) throws AccessDeniedException {
        if (!policy.hasPermission(principal, permission)) {
            throw new AccessDeniedException("Permission denied: " + permission.id(), null);
        }
    }
}
