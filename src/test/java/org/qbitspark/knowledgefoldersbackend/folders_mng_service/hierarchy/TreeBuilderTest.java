package org.qbitspark.knowledgefoldersbackend.folders_mng_service.hierarchy;

import org.junit.jupiter.api.Test;
import org.qbitspark.knowledgefoldersbackend.folders_mng_service.entity.FolderEntity;
import org.qbitspark.knowledgefoldersbackend.folders_mng_service.payload.FolderTreeItem;
import org.qbitspark.knowledgefoldersbackend.folders_mng_service.payload.FolderTreeNode;
import org.qbitspark.knowledgefoldersbackend.folders_mng_service.payload.SourceInFolderResponse;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.qbitspark.knowledgefoldersbackend.folders_mng_service.hierarchy.HierarchyFixtures.folder;
import static org.qbitspark.knowledgefoldersbackend.folders_mng_service.hierarchy.HierarchyFixtures.link;
import static org.qbitspark.knowledgefoldersbackend.folders_mng_service.hierarchy.HierarchyFixtures.sources;

class TreeBuilderTest {

    private final TreeBuilder treeBuilder = new TreeBuilder();

    @Test
    void buildForest_nestsChildrenAndCarriesCounts() {
        FolderEntity a = folder(UUID.randomUUID(), null, "A", 0);
        FolderEntity b = folder(UUID.randomUUID(), a, "B", 0);
        FolderEntity c = folder(UUID.randomUUID(), b, "C", 0);
        FolderCountSnapshot counts = FolderCountSnapshot.of(
                List.of(link(a.getFolderId(), null, "A"), link(b.getFolderId(), a.getFolderId(), "B"),
                        link(c.getFolderId(), b.getFolderId(), "C")),
                List.of(sources(c.getFolderId(), 2), sources(b.getFolderId(), 1)));

        List<FolderTreeNode> roots = treeBuilder.buildForest(List.of(c, a, b), counts);

        assertThat(roots).hasSize(1);
        FolderTreeNode root = roots.get(0);
        assertThat(root.getName()).isEqualTo("A");
        assertThat(root.getTotalSources()).isEqualTo(3);
        assertThat(root.getSubfolderCount()).isEqualTo(1);

        FolderTreeNode nodeB = (FolderTreeNode) root.getChildren().get(0);
        assertThat(nodeB.getName()).isEqualTo("B");
        assertThat(nodeB.getSourceCount()).isEqualTo(1);
        assertThat(nodeB.getTotalSources()).isEqualTo(3);

        FolderTreeNode nodeC = (FolderTreeNode) nodeB.getChildren().get(0);
        assertThat(nodeC.getTotalSources()).isEqualTo(2);
        assertThat(nodeC.getChildren()).isEmpty();
    }

    @Test
    void buildForest_ordersSiblingsByPositionThenName() {
        FolderEntity parent = folder(UUID.randomUUID(), null, "Parent", 0);
        FolderEntity zeta = folder(UUID.randomUUID(), parent, "Zeta", 0);
        FolderEntity alpha = folder(UUID.randomUUID(), parent, "Alpha", 1);
        FolderEntity beta = folder(UUID.randomUUID(), parent, "Beta", 0);
        FolderEntity rootTwo = folder(UUID.randomUUID(), null, "Another", 2);

        List<FolderTreeNode> roots = treeBuilder.buildForest(
                List.of(alpha, rootTwo, zeta, parent, beta), FolderCountSnapshot.of(List.of(), List.of()));

        assertThat(roots).extracting(FolderTreeNode::getName).containsExactly("Parent", "Another");
        assertThat(roots.get(0).getChildren())
                .extracting(item -> ((FolderTreeNode) item).getName())
                .containsExactly("Beta", "Zeta", "Alpha");
    }

    @Test
    void buildForest_isDeterministicForAnyInputOrder() {
        FolderEntity root = folder(UUID.randomUUID(), null, "Root", 0);
        List<FolderEntity> folders = new ArrayList<>();
        folders.add(root);
        for (int i = 0; i < 12; i++) {
            folders.add(folder(UUID.randomUUID(), root, "Child " + (char) ('a' + i), i % 3));
        }
        FolderCountSnapshot counts = FolderCountSnapshot.of(List.of(), List.of());

        List<String> first = childNames(treeBuilder.buildForest(folders, counts).get(0));
        Collections.shuffle(folders);
        List<String> second = childNames(treeBuilder.buildForest(folders, counts).get(0));

        assertThat(second).isEqualTo(first);
    }

    @Test
    void buildForest_promotesOrphanToRoot() {
        FolderEntity missing = folder(UUID.randomUUID(), null, "Deleted", 0);
        FolderEntity orphan = folder(UUID.randomUUID(), missing, "Orphan", 0);
        FolderEntity root = folder(UUID.randomUUID(), null, "Root", 1);

        List<FolderTreeNode> roots = treeBuilder.buildForest(
                List.of(orphan, root), FolderCountSnapshot.of(List.of(), List.of()));

        assertThat(roots).extracting(FolderTreeNode::getName).containsExactly("Orphan", "Root");
        assertThat(roots.get(0).getParentId()).isEqualTo(missing.getFolderId());
    }

    @Test
    void buildForest_rejectsStoredCycle() {
        FolderEntity a = folder(UUID.randomUUID(), null, "A", 0);
        FolderEntity b = folder(UUID.randomUUID(), a, "B", 0);
        a.setParentFolder(b);
        FolderEntity healthy = folder(UUID.randomUUID(), null, "Healthy", 0);

        assertThatThrownBy(() -> treeBuilder.buildForest(
                List.of(a, b, healthy), FolderCountSnapshot.of(List.of(), List.of())))
                .isInstanceOf(HierarchyCorruptedException.class)
                .hasMessageContaining("cycle");
    }

    @Test
    void buildForest_appendsSourceLeavesAfterChildFolders() {
        FolderEntity root = folder(UUID.randomUUID(), null, "Root", 0);
        FolderEntity child = folder(UUID.randomUUID(), root, "Child", 0);
        SourceInFolderResponse docs = SourceInFolderResponse.builder()
                .id("src-2").sourceId("src-2").title("Docs").folderId(root.getFolderId()).build();
        SourceInFolderResponse api = SourceInFolderResponse.builder()
                .id("src-1").sourceId("src-1").title("API reference").folderId(root.getFolderId()).build();

        List<FolderTreeNode> roots = treeBuilder.buildForest(List.of(root, child),
                FolderCountSnapshot.of(List.of(), List.of()),
                Map.of(root.getFolderId(), List.of(docs, api)));

        List<FolderTreeItem> children = roots.get(0).getChildren();
        assertThat(children).extracting(FolderTreeItem::getNodeType).containsExactly("folder", "source", "source");
        assertThat(children.get(1)).isSameAs(api);
        assertThat(children.get(2)).isSameAs(docs);
    }

    @Test
    void buildForest_emptyInputGivesEmptyForest() {
        assertThat(treeBuilder.buildForest(List.of(), FolderCountSnapshot.of(List.of(), List.of()))).isEmpty();
    }

    private List<String> childNames(FolderTreeNode node) {
        return node.getChildren().stream()
                .map(item -> ((FolderTreeNode) item).getName())
                .toList();
    }
}
