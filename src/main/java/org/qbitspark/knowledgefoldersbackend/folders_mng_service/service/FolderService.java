package org.qbitspark.knowledgefoldersbackend.folders_mng_service.service;

import org.qbitspark.knowledgefoldersbackend.folders_mng_service.payload.*;
import org.qbitspark.knowledgefoldersbackend.globeadvice.exceptions.ItemNotFoundException;
import org.qbitspark.knowledgefoldersbackend.globeadvice.exceptions.OperationFailedException;
import org.qbitspark.knowledgefoldersbackend.globeadvice.exceptions.ValidationFailedException;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Folder hierarchy operations. Mutations propagate every failure; reads log
 * persistence failures and answer with an empty result instead.
 */
public interface FolderService {
    FolderResponse createFolder(CreateFolderRequest request) throws ItemNotFoundException;

    FolderResponse updateFolder(UUID folderId, UpdateFolderRequest request) throws ItemNotFoundException, ValidationFailedException;

    FolderResponse moveFolder(UUID folderId, UUID newParentId) throws ItemNotFoundException, ValidationFailedException;

    DeleteFolderResponse deleteFolder(UUID folderId, boolean moveContentsToParent) throws ItemNotFoundException, OperationFailedException;

    MoveSourceResponse moveSource(String sourceId, UUID folderId) throws ItemNotFoundException;

    BatchMoveSourcesResponse batchMoveSources(BatchMoveSourcesRequest request) throws ItemNotFoundException, ValidationFailedException;

    Optional<FolderResponse> getFolder(UUID folderId);

    List<FolderResponse> listFolders(UUID parentFolderId, boolean includeCounts);

    FolderTreeResponse getFolderTree(boolean includeSources);

    Optional<FolderContentsResponse> getFolderContents(UUID folderId, boolean includeSources, boolean includeSubfolders);
}
