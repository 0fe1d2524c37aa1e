package org.qbitspark.knowledgefoldersbackend.folders_mng_service.hierarchy;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.qbitspark.knowledgefoldersbackend.folders_mng_service.entity.FolderEntity;
import org.qbitspark.knowledgefoldersbackend.folders_mng_service.repo.FolderLink;
import org.qbitspark.knowledgefoldersbackend.folders_mng_service.repo.FolderRepository;
import org.qbitspark.knowledgefoldersbackend.folders_mng_service.repo.KnowledgeSourceRepository;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Walks the hierarchy in the application, one lookup per ancestor.
 * The descendant check locks every folder row it visits; path walks read link
 * projections without locking. Recursive counts load all folder links and a
 * grouped source count once.
 */
@Slf4j
@RequiredArgsConstructor
public class ClientSideHierarchyQueries implements HierarchyQueries {

    private final FolderRepository folderRepository;
    private final KnowledgeSourceRepository sourceRepository;
    private final HierarchyProperties properties;

    @Override
    public boolean isDescendant(UUID folderId, UUID potentialAncestorId) {
        if (folderId == null || potentialAncestorId == null) {
            return false;
        }

        UUID current = folderId;
        for (int depth = 0; depth <= properties.getMaxDepth(); depth++) {
            if (current.equals(potentialAncestorId)) {
                return true;
            }
            UUID lookupId = current;
            FolderEntity folder = folderRepository.findForUpdate(lookupId)
                    .orElseThrow(() -> new HierarchyIntegrityException(
                            "Folder " + lookupId + " not found while walking ancestors of " + folderId));
            if (folder.getParentFolderId() == null) {
                return false;
            }
            current = folder.getParentFolderId();
        }
        throw new HierarchyDepthExceededException(
                "Ancestor chain of folder " + folderId + " exceeds maximum depth " + properties.getMaxDepth());
    }

    @Override
    public List<String> folderPath(UUID folderId) {
        List<String> reversed = new ArrayList<>();
        UUID current = folderId;
        for (int depth = 0; current != null && depth < properties.getMaxDepth(); depth++) {
            Optional<FolderLink> link = folderRepository.findLinkByFolderId(current);
            if (link.isEmpty()) {
                log.warn("Path walk for folder {} stopped at missing folder {}", folderId, current);
                break;
            }
            reversed.add(link.get().getName());
            current = link.get().getParentId();
        }
        return ImmutableList.copyOf(Lists.reverse(reversed));
    }

    @Override
    public long totalSourceCount(UUID folderId) {
        FolderCountSnapshot snapshot = FolderCountSnapshot.of(
                folderRepository.findAllLinks(), sourceRepository.countGroupedByFolder());
        return snapshot.totalSources(folderId);
    }
}
