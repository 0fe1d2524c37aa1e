package org.qbitspark.knowledgefoldersbackend.folders_mng_service.hierarchy;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.qbitspark.knowledgefoldersbackend.folders_mng_service.repo.FolderRepository;
import org.qbitspark.knowledgefoldersbackend.folders_mng_service.repo.KnowledgeSourceRepository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.qbitspark.knowledgefoldersbackend.folders_mng_service.hierarchy.HierarchyFixtures.link;
import static org.qbitspark.knowledgefoldersbackend.folders_mng_service.hierarchy.HierarchyFixtures.sources;
import static org.qbitspark.knowledgefoldersbackend.folders_mng_service.hierarchy.HierarchyFixtures.stored;

@ExtendWith(MockitoExtension.class)
class ClientSideHierarchyQueriesTest {

    @Mock
    private FolderRepository folderRepository;

    @Mock
    private KnowledgeSourceRepository sourceRepository;

    private HierarchyProperties properties;
    private ClientSideHierarchyQueries queries;

    private final UUID root = UUID.randomUUID();
    private final UUID middle = UUID.randomUUID();
    private final UUID leaf = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        properties = new HierarchyProperties();
        queries = new ClientSideHierarchyQueries(folderRepository, sourceRepository, properties);
    }

    private void stubChain() {
        when(folderRepository.findLinkByFolderId(root)).thenReturn(Optional.of(link(root, null, "Engineering")));
        when(folderRepository.findLinkByFolderId(middle)).thenReturn(Optional.of(link(middle, root, "Backend")));
        when(folderRepository.findLinkByFolderId(leaf)).thenReturn(Optional.of(link(leaf, middle, "APIs")));
    }

    @Test
    void isDescendant_findsAncestorUpTheChain() {
        when(folderRepository.findForUpdate(leaf)).thenReturn(stored(leaf, middle));
        when(folderRepository.findForUpdate(middle)).thenReturn(stored(middle, root));

        assertThat(queries.isDescendant(leaf, root)).isTrue();
    }

    @Test
    void isDescendant_locksEveryVisitedFolder() {
        when(folderRepository.findForUpdate(leaf)).thenReturn(stored(leaf, middle));
        when(folderRepository.findForUpdate(middle)).thenReturn(stored(middle, root));
        when(folderRepository.findForUpdate(root)).thenReturn(stored(root, null));

        assertThat(queries.isDescendant(leaf, UUID.randomUUID())).isFalse();

        verify(folderRepository).findForUpdate(leaf);
        verify(folderRepository).findForUpdate(middle);
        verify(folderRepository).findForUpdate(root);
        verify(folderRepository, never()).findLinkByFolderId(any());
    }

    @Test
    void isDescendant_falseWhenRootReached() {
        when(folderRepository.findForUpdate(root)).thenReturn(stored(root, null));
        when(folderRepository.findForUpdate(middle)).thenReturn(stored(middle, root));

        assertThat(queries.isDescendant(root, leaf)).isFalse();
        assertThat(queries.isDescendant(middle, leaf)).isFalse();
    }

    @Test
    void isDescendant_folderIsItsOwnDescendant() {
        assertThat(queries.isDescendant(leaf, leaf)).isTrue();
        verify(folderRepository, never()).findForUpdate(any());
    }

    @Test
    void isDescendant_nullArgumentsAreFalse() {
        assertThat(queries.isDescendant(null, root)).isFalse();
        assertThat(queries.isDescendant(leaf, null)).isFalse();
    }

    @Test
    void isDescendant_missingRecordOnChainThrows() {
        when(folderRepository.findForUpdate(leaf)).thenReturn(stored(leaf, middle));
        when(folderRepository.findForUpdate(middle)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> queries.isDescendant(leaf, root))
                .isExactlyInstanceOf(HierarchyIntegrityException.class)
                .hasMessageContaining(middle.toString());
    }

    @Test
    void isDescendant_exhaustedDepthThrows() {
        UUID a = UUID.randomUUID();
        UUID b = UUID.randomUUID();
        properties.setMaxDepth(5);
        when(folderRepository.findForUpdate(a)).thenReturn(stored(a, b));
        when(folderRepository.findForUpdate(b)).thenReturn(stored(b, a));

        assertThatThrownBy(() -> queries.isDescendant(a, root))
                .isInstanceOf(HierarchyDepthExceededException.class)
                .hasMessageContaining("maximum depth 5");
    }

    @Test
    void folderPath_rootIsItsOwnName() {
        when(folderRepository.findLinkByFolderId(root)).thenReturn(Optional.of(link(root, null, "Engineering")));

        assertThat(queries.folderPath(root)).containsExactly("Engineering");
    }

    @Test
    void folderPath_returnsNamesFromRootToFolder() {
        stubChain();

        assertThat(queries.folderPath(leaf)).containsExactly("Engineering", "Backend", "APIs");
        assertThat(queries.folderPath(middle)).containsExactly("Engineering", "Backend");
    }

    @Test
    void folderPath_unknownFolderGivesEmptyPath() {
        UUID unknown = UUID.randomUUID();
        when(folderRepository.findLinkByFolderId(unknown)).thenReturn(Optional.empty());

        assertThat(queries.folderPath(unknown)).isEmpty();
    }

    @Test
    void folderPath_stopsAtMissingAncestor() {
        when(folderRepository.findLinkByFolderId(leaf)).thenReturn(Optional.of(link(leaf, middle, "APIs")));
        when(folderRepository.findLinkByFolderId(middle)).thenReturn(Optional.empty());

        assertThat(queries.folderPath(leaf)).containsExactly("APIs");
    }

    @Test
    void folderPath_isBoundedByMaxDepth() {
        UUID a = UUID.randomUUID();
        UUID b = UUID.randomUUID();
        properties.setMaxDepth(4);
        when(folderRepository.findLinkByFolderId(a)).thenReturn(Optional.of(link(a, b, "A")));
        when(folderRepository.findLinkByFolderId(b)).thenReturn(Optional.of(link(b, a, "B")));

        assertThat(queries.folderPath(a)).containsExactly("B", "A", "B", "A");
    }

    @Test
    void totalSourceCount_sumsWholeSubtree() {
        when(folderRepository.findAllLinks()).thenReturn(List.of(
                link(root, null, "Engineering"), link(middle, root, "Backend"), link(leaf, middle, "APIs")));
        when(sourceRepository.countGroupedByFolder()).thenReturn(List.of(
                sources(root, 1), sources(middle, 2), sources(leaf, 4)));

        assertThat(queries.totalSourceCount(root)).isEqualTo(7);
        assertThat(queries.totalSourceCount(middle)).isEqualTo(6);
        assertThat(queries.totalSourceCount(leaf)).isEqualTo(4);
    }
}
