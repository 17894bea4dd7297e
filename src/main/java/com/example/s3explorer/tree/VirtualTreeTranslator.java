package com.example.s3explorer.tree;

import com.example.s3explorer.policy.AccessPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Turns a flat delimiter listing into the folders and files directly below a prefix.
 *
 * <p>Folders are the common prefixes, named by their last segment; files are the keys with no
 * further delimiter after the prefix. Backend order is preserved for both. Marker objects and the
 * prefix itself are not files.</p>
 */
public final class VirtualTreeTranslator {
    private static final Logger LOGGER = LoggerFactory.getLogger(VirtualTreeTranslator.class);
    private static final String DELIMITER = AccessPolicy.DELIMITER;

    public TreeListing listChildren(String prefix, RawListing rawListing) {
        String listPrefix = AccessPolicy.folderPrefix(prefix == null ? "" : prefix);
        List<TreeNode> folders = new ArrayList<>();
        Set<String> seenFolders = new LinkedHashSet<>();
        for (String commonPrefix : rawListing.commonPrefixes()) {
            if (commonPrefix == null || !commonPrefix.startsWith(listPrefix)) {
                continue;
            }
            String remainder = commonPrefix.substring(listPrefix.length());
            int slash = remainder.indexOf(DELIMITER);
            String name = slash < 0 ? remainder : remainder.substring(0, slash);
            if (name.isEmpty()) {
                continue;
            }
            String key = listPrefix + name + DELIMITER;
            if (seenFolders.add(key)) {
                folders.add(TreeNode.folder(key, name));
            }
        }

        List<TreeNode> files = new ArrayList<>();
        for (ObjectSummary object : rawListing.objects()) {
            String key = object.key();
            if (key == null || !key.startsWith(listPrefix)) {
                continue;
            }
            String name = key.substring(listPrefix.length());
            if (name.isEmpty() || name.contains(DELIMITER)) {
                continue;
            }
            files.add(TreeNode.file(key, name, object.size(), object.lastModified(), object.etag()));
        }
        LOGGER.debug("Listed {} folders and {} files under '{}'", folders.size(), files.size(), listPrefix);
        return new TreeListing(listPrefix, folders, files);
    }

    /**
     * Slices one page out of {@code nodes}. The page number is clamped to
     * {@code [1, ceil(total / pageSize)]}, and there is always at least one page.
     */
    public <T> Page<T> paginate(List<T> nodes, PageCursor cursor) {
        int total = nodes.size();
        int pageSize = cursor.pageSize();
        int totalPages = Math.max(1, (total + pageSize - 1) / pageSize);
        int page = Math.min(Math.max(1, cursor.pageNumber()), totalPages);
        int from = Math.min(total, (page - 1) * pageSize);
        int to = Math.min(total, from + pageSize);
        return new Page<>(nodes.subList(from, to), page, pageSize, total, totalPages);
    }

    public Page<TreeNode> paginate(TreeListing listing, PageCursor cursor) {
        return paginate(listing.nodes(), cursor);
    }

    /**
     * Root first, then one crumb per segment. Every crumb except the last links to its folder.
     */
    public List<Breadcrumb> breadcrumbs(String prefix) {
        String[] segments = AccessPolicy.folderPrefix(prefix == null ? "" : prefix).split(DELIMITER);
        List<String> names = new ArrayList<>();
        for (String segment : segments) {
            if (!segment.isEmpty()) {
                names.add(segment);
            }
        }
        List<Breadcrumb> crumbs = new ArrayList<>(names.size() + 1);
        crumbs.add(new Breadcrumb("", "", !names.isEmpty()));
        StringBuilder path = new StringBuilder();
        for (int i = 0; i < names.size(); i++) {
            path.append(names.get(i)).append(DELIMITER);
            boolean terminal = i == names.size() - 1;
            crumbs.add(new Breadcrumb(names.get(i), path.toString(), !terminal));
        }
        return crumbs;
    }
}
