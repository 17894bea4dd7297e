package com.example.s3explorer;

import com.example.s3explorer.tree.Breadcrumb;
import com.example.s3explorer.tree.Page;
import com.example.s3explorer.tree.TreeNode;

import java.util.List;

/**
 * One page of a folder together with the breadcrumbs leading to it. {@code prefix} is the folder
 * actually listed, which can differ from the one requested.
 */
public record FolderView(
        String prefix,
        List<Breadcrumb> breadcrumbs,
        Page<TreeNode> page
) {
    public FolderView {
        breadcrumbs = List.copyOf(breadcrumbs);
    }
}
