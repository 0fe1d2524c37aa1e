package org.qbitspark.knowledgefoldersbackend.folders_mng_service.hierarchy;

import com.google.common.base.Preconditions;
import lombok.extern.slf4j.Slf4j;
import org.qbitspark.knowledgefoldersbackend.folders_mng_service.entity.FolderEntity;
import org.qbitspark.knowledgefoldersbackend.folders_mng_service.payload.FolderTreeItem;
import org.qbitspark.knowledgefoldersbackend.folders_mng_service.payload.FolderTreeNode;
import org.qbitspark.knowledgefoldersbackend.folders_mng_service.payload.SourceInFolderResponse;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Assembles the complete flat folder list into a sorted forest.
 *
 * <p>Nodes live in an array and the parent/child relation is kept as indices. A
 * folder whose stored parent id does not match any folder in the input is an
 * orphan and is placed at root level. Folders that no root can reach sit on a
 * stored cycle; the build refuses such input with a {@link HierarchyCorruptedException}.
 */
@Component
@Slf4j
public class TreeBuilder {

    static final Comparator<FolderTreeNode> SIBLING_ORDER =
            SiblingOrder.of(FolderTreeNode::getPosition, FolderTreeNode::getName);

    static final Comparator<SourceInFolderResponse> SOURCE_ORDER = Comparator
            .<SourceInFolderResponse, String>comparing(TreeBuilder::sourceLabel, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(SourceInFolderResponse::getSourceId, Comparator.nullsLast(Comparator.<String>naturalOrder()));

    public List<FolderTreeNode> buildForest(List<FolderEntity> folders, FolderCountSnapshot counts) {
        return buildForest(folders, counts, Map.of());
    }

    /**
     * @param sourcesByFolder source leaves to attach per folder id; empty for a folders-only tree
     */
    public List<FolderTreeNode> buildForest(List<FolderEntity> folders,
                                            FolderCountSnapshot counts,
                                            Map<UUID, List<SourceInFolderResponse>> sourcesByFolder) {
        Preconditions.checkNotNull(folders, "folders");
        Preconditions.checkNotNull(counts, "counts");

        // First pass: one node per folder
        int size = folders.size();
        FolderTreeNode[] nodes = new FolderTreeNode[size];
        Map<UUID, Integer> indexById = new HashMap<>(size * 2);
        for (int i = 0; i < size; i++) {
            FolderEntity folder = folders.get(i);
            nodes[i] = toNode(folder, counts);
            indexById.put(folder.getFolderId(), i);
        }

        // Second pass: link children to parents by index
        List<List<Integer>> childIndexes = new ArrayList<>(size);
        List<Integer> rootIndexes = new ArrayList<>();
        for (int i = 0; i < size; i++) {
            childIndexes.add(new ArrayList<>());
        }
        for (int i = 0; i < size; i++) {
            UUID parentId = nodes[i].getParentId();
            Integer parent = parentId != null ? indexById.get(parentId) : null;
            if (parent == null) {
                if (parentId != null) {
                    log.warn("Folder {} references missing parent {}, placing it at root level",
                            nodes[i].getId(), parentId);
                }
                rootIndexes.add(i);
            } else {
                childIndexes.get(parent).add(i);
            }
        }

        assertAllReachable(nodes, rootIndexes, childIndexes);

        for (int i = 0; i < size; i++) {
            List<FolderTreeNode> childFolders = new ArrayList<>(childIndexes.get(i).size());
            for (int child : childIndexes.get(i)) {
                childFolders.add(nodes[child]);
            }
            childFolders.sort(SIBLING_ORDER);

            List<SourceInFolderResponse> leaves = new ArrayList<>(
                    sourcesByFolder.getOrDefault(nodes[i].getId(), List.of()));
            leaves.sort(SOURCE_ORDER);

            List<FolderTreeItem> children = new ArrayList<>(childFolders.size() + leaves.size());
            children.addAll(childFolders);
            children.addAll(leaves);
            nodes[i].setChildren(children);
        }

        List<FolderTreeNode> roots = new ArrayList<>(rootIndexes.size());
        for (int root : rootIndexes) {
            roots.add(nodes[root]);
        }
        roots.sort(SIBLING_ORDER);
        return roots;
    }

    private void assertAllReachable(FolderTreeNode[] nodes, List<Integer> rootIndexes, List<List<Integer>> childIndexes) {
        boolean[] reached = new boolean[nodes.length];
        List<Integer> pending = new ArrayList<>(rootIndexes);
        int reachedCount = 0;
        while (!pending.isEmpty()) {
            int node = pending.remove(pending.size() - 1);
            if (reached[node]) {
                continue;
            }
            reached[node] = true;
            reachedCount++;
            pending.addAll(childIndexes.get(node));
        }
        for (int i = 0; reachedCount < nodes.length && i < nodes.length; i++) {
            if (!reached[i]) {
                throw new HierarchyCorruptedException("Folder " + nodes[i].getId() + " sits on a parent cycle, "
                        + (nodes.length - reachedCount) + " folders cannot be reached from a root");
            }
        }
    }

    private FolderTreeNode toNode(FolderEntity folder, FolderCountSnapshot counts) {
        UUID id = folder.getFolderId();
        return FolderTreeNode.builder()
                .id(id)
                .parentId(folder.getParentFolderId())
                .name(folder.getName())
                .description(folder.getDescription())
                .color(folder.getColor())
                .icon(folder.getIcon())
                .position(folder.getPosition())
                .metadata(folder.getMetadata())
                .createdAt(folder.getCreatedAt())
                .updatedAt(folder.getUpdatedAt())
                .sourceCount(counts.directSources(id))
                .subfolderCount(counts.directSubfolders(id))
                .totalSources(counts.totalSources(id))
                .build();
    }

    private static String sourceLabel(SourceInFolderResponse source) {
        if (source.getTitle() != null) {
            return source.getTitle();
        }
        return source.getSourceDisplayName() != null ? source.getSourceDisplayName() : source.getSourceId();
    }
}
