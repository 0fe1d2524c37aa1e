package org.qbitspark.knowledgefoldersbackend.folders_mng_service.hierarchy;

import lombok.RequiredArgsConstructor;
import org.qbitspark.knowledgefoldersbackend.folders_mng_service.repo.FolderRepository;
import org.qbitspark.knowledgefoldersbackend.folders_mng_service.repo.KnowledgeSourceRepository;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Source and subfolder counts. Views covering more than one folder take a
 * {@link #snapshot()} and read every count from it instead of querying per folder.
 */
@Component
@RequiredArgsConstructor
public class AggregationEngine {

    private final FolderRepository folderRepository;
    private final KnowledgeSourceRepository sourceRepository;
    private final HierarchyQueries hierarchyQueries;

    public long directSourceCount(UUID folderId) {
        return sourceRepository.countByFolderId(folderId);
    }

    public long directSubfolderCount(UUID folderId) {
        return folderRepository.countByParentFolder_FolderId(folderId);
    }

    public long totalSourceCount(UUID folderId) {
        return hierarchyQueries.totalSourceCount(folderId);
    }

    public FolderCountSnapshot snapshot() {
        return FolderCountSnapshot.of(folderRepository.findAllLinks(), sourceRepository.countGroupedByFolder());
    }
}
