package org.qbitspark.knowledgefoldersbackend.folders_mng_service.service.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.qbitspark.knowledgefoldersbackend.folders_mng_service.entity.FolderEntity;
import org.qbitspark.knowledgefoldersbackend.folders_mng_service.entity.KnowledgeSourceEntity;
import org.qbitspark.knowledgefoldersbackend.folders_mng_service.hierarchy.AggregationEngine;
import org.qbitspark.knowledgefoldersbackend.folders_mng_service.hierarchy.FolderCountSnapshot;
import org.qbitspark.knowledgefoldersbackend.folders_mng_service.hierarchy.HierarchyValidator;
import org.qbitspark.knowledgefoldersbackend.folders_mng_service.hierarchy.PathResolver;
import org.qbitspark.knowledgefoldersbackend.folders_mng_service.hierarchy.SiblingOrder;
import org.qbitspark.knowledgefoldersbackend.folders_mng_service.hierarchy.TreeBuilder;
import org.qbitspark.knowledgefoldersbackend.folders_mng_service.payload.*;
import org.qbitspark.knowledgefoldersbackend.folders_mng_service.repo.FolderLink;
import org.qbitspark.knowledgefoldersbackend.folders_mng_service.repo.FolderRepository;
import org.qbitspark.knowledgefoldersbackend.folders_mng_service.repo.KnowledgeSourceRepository;
import org.qbitspark.knowledgefoldersbackend.folders_mng_service.service.FolderService;
import org.qbitspark.knowledgefoldersbackend.globeadvice.exceptions.ItemNotFoundException;
import org.qbitspark.knowledgefoldersbackend.globeadvice.exceptions.OperationFailedException;
import org.qbitspark.knowledgefoldersbackend.globeadvice.exceptions.ValidationFailedException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.*;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class FolderServiceImpl implements FolderService {

    private final FolderRepository folderRepository;
    private final KnowledgeSourceRepository sourceRepository;
    private final HierarchyValidator hierarchyValidator;
    private final AggregationEngine aggregationEngine;
    private final PathResolver pathResolver;
    private final TreeBuilder treeBuilder;

    @Override
    @Transactional(rollbackFor = Exception.class)
    public FolderResponse createFolder(CreateFolderRequest request) throws ItemNotFoundException {
        log.info("Creating folder: {} with parent: {}", request.getName(), request.getParentFolderId());

        // 1. Validate parent folder if provided
        FolderEntity parentFolder = null;
        if (request.getParentFolderId() != null) {
            parentFolder = findParentFolder(request.getParentFolderId());
        }

        // 2. Create a new folder entity
        FolderEntity newFolder = new FolderEntity();
        newFolder.setName(request.getName());
        newFolder.setDescription(request.getDescription());
        newFolder.setColor(request.getColor());
        newFolder.setIcon(request.getIcon());
        newFolder.setPosition(request.getPosition() != null ? request.getPosition() : 0);
        newFolder.setMetadata(request.getMetadata() != null ? new HashMap<>(request.getMetadata()) : new HashMap<>());
        newFolder.setParentFolder(parentFolder);

        FolderEntity savedFolder = folderRepository.saveAndFlush(newFolder);

        // 3. A fresh folder has no subfolders, so its total equals its direct count
        long sourceCount = aggregationEngine.directSourceCount(savedFolder.getFolderId());

        log.info("Folder created successfully: {}", savedFolder.getFolderId());

        return toFolderResponse(savedFolder, sourceCount, 0L, sourceCount);
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public FolderResponse updateFolder(UUID folderId, UpdateFolderRequest request)
            throws ItemNotFoundException, ValidationFailedException {

        log.info("Updating folder {}", folderId);

        FolderEntity folder = lockFolder(folderId);

        if (!request.hasChanges()) {
            log.info("No changes requested for folder {}", folderId);
            return toFolderResponseWithCounts(folder);
        }

        if (request.getName() != null) {
            folder.setName(request.getName());
        }
        if (request.getDescription() != null) {
            folder.setDescription(request.getDescription());
        }
        if (request.getColor() != null) {
            folder.setColor(request.getColor());
        }
        if (request.getIcon() != null) {
            folder.setIcon(request.getIcon());
        }
        if (request.getPosition() != null) {
            folder.setPosition(request.getPosition());
        }
        if (request.getMetadata() != null) {
            folder.setMetadata(new HashMap<>(request.getMetadata()));
        }
        if (request.getParentFolderId() != null) {
            reparent(folder, request.getParentFolderId());
        }

        FolderEntity savedFolder = folderRepository.saveAndFlush(folder);

        log.info("Folder {} updated successfully", folderId);

        return toFolderResponseWithCounts(savedFolder);
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public FolderResponse moveFolder(UUID folderId, UUID newParentId)
            throws ItemNotFoundException, ValidationFailedException {

        log.info("Moving folder {} to parent {}", folderId, newParentId != null ? newParentId : "root");

        FolderEntity folder = lockFolder(folderId);

        if (newParentId == null) {
            folder.setParentFolder(null);
        } else {
            reparent(folder, newParentId);
        }

        FolderEntity savedFolder = folderRepository.saveAndFlush(folder);

        log.info("Folder {} moved successfully", folderId);

        return toFolderResponseWithCounts(savedFolder);
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public DeleteFolderResponse deleteFolder(UUID folderId, boolean moveContentsToParent)
            throws ItemNotFoundException, OperationFailedException {

        log.info("Deleting folder {}, moveContentsToParent={}", folderId, moveContentsToParent);

        FolderEntity folder = lockFolder(folderId);
        String folderName = folder.getName();
        FolderEntity parentFolder = folder.getParentFolder();
        UUID parentFolderId = folder.getParentFolderId();

        DeleteFolderResponse.DeleteFolderResponseBuilder response = DeleteFolderResponse.builder()
                .folderId(folderId)
                .folderName(folderName)
                .movedToParent(moveContentsToParent);

        if (moveContentsToParent) {
            // Contents move up exactly one level; nothing deeper is touched
            int sourcesMoved = sourceRepository.reassignFolder(folderId, parentFolderId);

            List<FolderEntity> children = folderRepository.findByParentFolder_FolderId(folderId);
            for (FolderEntity child : children) {
                child.setParentFolder(parentFolder);
            }

            response.newParentId(parentFolderId)
                    .sourcesMoved(sourcesMoved)
                    .foldersMoved(children.size());
        } else {
            List<List<UUID>> descendantLevels = collectDescendantLevels(folderId);

            List<UUID> subtree = new ArrayList<>();
            subtree.add(folderId);
            descendantLevels.forEach(subtree::addAll);

            int sourcesDeleted = sourceRepository.deleteByFolderIdIn(subtree);

            // Deepest level first so no parent reference dangles
            int foldersDeleted = 0;
            for (int level = descendantLevels.size() - 1; level >= 0; level--) {
                foldersDeleted += folderRepository.deleteAllByFolderIdIn(descendantLevels.get(level));
            }

            response.sourcesDeleted(sourcesDeleted)
                    .foldersDeleted(foldersDeleted);
        }

        int removed = folderRepository.removeByFolderId(folderId);
        if (removed == 0) {
            throw new OperationFailedException("Failed to delete folder " + folderId + ": no rows affected");
        }

        log.info("Folder '{}' deleted successfully", folderName);

        return response
                .message("Folder '" + folderName + "' deleted successfully")
                .build();
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public MoveSourceResponse moveSource(String sourceId, UUID folderId) throws ItemNotFoundException {

        log.info("Moving source {} to folder {}", sourceId, folderId != null ? folderId : "root");

        requireTargetFolder(folderId);

        int updated = sourceRepository.assignFolder(sourceId, folderId);
        if (updated == 0) {
            throw new ItemNotFoundException("Source " + sourceId + " not found");
        }

        return MoveSourceResponse.builder()
                .sourceId(sourceId)
                .folderId(folderId)
                .message("Source moved successfully")
                .build();
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public BatchMoveSourcesResponse batchMoveSources(BatchMoveSourcesRequest request)
            throws ItemNotFoundException, ValidationFailedException {

        validateBatchMoveRequest(request);

        UUID folderId = request.getFolderId();
        log.info("Starting batch source move - Sources: {}, Destination: {}",
                request.getSourceIds().size(), folderId != null ? folderId : "root");

        // Validate destination folder once for the whole batch
        requireTargetFolder(folderId);

        List<String> sourceIds = new ArrayList<>(new LinkedHashSet<>(request.getSourceIds()));
        Set<String> existingIds = sourceRepository.findAllById(sourceIds).stream()
                .map(KnowledgeSourceEntity::getSourceId)
                .collect(Collectors.toSet());

        List<String> movedSourceIds = new ArrayList<>();
        List<BatchMoveSourcesResponse.FailedOperation> failures = new ArrayList<>();

        for (String sourceId : sourceIds) {
            if (!existingIds.contains(sourceId)) {
                failures.add(failure(sourceId, "Source not found"));
                log.warn("Skipping missing source {} in batch move", sourceId);
                continue;
            }

            int updated = sourceRepository.assignFolder(sourceId, folderId);
            if (updated == 0) {
                failures.add(failure(sourceId, "Move failed: no rows updated"));
                log.warn("Failed to move source {}: no rows updated", sourceId);
            } else {
                movedSourceIds.add(sourceId);
                log.debug("Successfully moved source: {} to {}", sourceId, folderId);
            }
        }

        int totalRequested = sourceIds.size();

        log.info("Batch source move completed - Success: {}, Failed: {}", movedSourceIds.size(), failures.size());

        return BatchMoveSourcesResponse.builder()
                .totalSourcesRequested(totalRequested)
                .successfulMoves(movedSourceIds.size())
                .failedMoves(failures.size())
                .movedSourceIds(movedSourceIds)
                .failures(failures)
                .folderId(folderId)
                .summary(buildMoveSummary(movedSourceIds.size(), failures.size(), totalRequested))
                .build();
    }

    @Override
    public Optional<FolderResponse> getFolder(UUID folderId) {
        try {
            return folderRepository.findById(folderId).map(this::toFolderResponseWithCounts);
        } catch (RuntimeException e) {
            log.error("Failed to get folder {}", folderId, e);
            return Optional.empty();
        }
    }

    @Override
    public List<FolderResponse> listFolders(UUID parentFolderId, boolean includeCounts) {
        try {
            List<FolderEntity> folders = parentFolderId == null
                    ? folderRepository.findByParentFolderIsNull()
                    : folderRepository.findByParentFolder_FolderId(parentFolderId);

            FolderCountSnapshot counts = includeCounts ? aggregationEngine.snapshot() : null;

            return folders.stream()
                    .sorted(SiblingOrder.FOLDERS)
                    .map(folder -> toFolderResponse(folder, counts))
                    .toList();
        } catch (RuntimeException e) {
            log.error("Failed to list folders under {}", parentFolderId, e);
            return List.of();
        }
    }

    @Override
    public FolderTreeResponse getFolderTree(boolean includeSources) {
        try {
            log.info("Building folder tree, includeSources={}", includeSources);

            List<FolderEntity> folders = folderRepository.findAll();
            FolderCountSnapshot counts = aggregationEngine.snapshot();
            Map<UUID, List<SourceInFolderResponse>> sourcesByFolder = includeSources
                    ? loadSourcesByFolder()
                    : Map.of();

            List<FolderTreeNode> tree = treeBuilder.buildForest(folders, counts, sourcesByFolder);
            long totalSources = tree.stream().mapToLong(FolderTreeNode::getTotalSources).sum();

            return FolderTreeResponse.builder()
                    .tree(tree)
                    .totalFolders(folders.size())
                    .totalSources(totalSources)
                    .build();
        } catch (RuntimeException e) {
            log.error("Failed to build folder tree", e);
            return FolderTreeResponse.builder()
                    .tree(List.of())
                    .totalFolders(0)
                    .totalSources(0)
                    .build();
        }
    }

    @Override
    public Optional<FolderContentsResponse> getFolderContents(UUID folderId, boolean includeSources, boolean includeSubfolders) {
        try {
            Optional<FolderEntity> folder = folderRepository.findById(folderId);
            if (folder.isEmpty()) {
                log.info("Folder {} not found for contents", folderId);
                return Optional.empty();
            }

            FolderCountSnapshot counts = aggregationEngine.snapshot();

            List<FolderResponse> subfolders = includeSubfolders
                    ? folderRepository.findByParentFolder_FolderId(folderId).stream()
                            .sorted(SiblingOrder.FOLDERS)
                            .map(subfolder -> toFolderResponse(subfolder, counts))
                            .toList()
                    : List.of();

            List<SourceInFolderResponse> sources = includeSources
                    ? sourceRepository.findByFolderIdOrderByCreatedAtDesc(folderId).stream()
                            .map(SourceInFolderResponse::from)
                            .toList()
                    : List.of();

            return Optional.of(FolderContentsResponse.builder()
                    .folder(toFolderResponse(folder.get(), counts))
                    .subfolders(subfolders)
                    .sources(sources)
                    .path(pathResolver.pathTo(folderId))
                    .build());
        } catch (RuntimeException e) {
            log.error("Failed to get folder contents for {}", folderId, e);
            return Optional.empty();
        }
    }

    private FolderEntity lockFolder(UUID folderId) throws ItemNotFoundException {
        return folderRepository.findForUpdate(folderId)
                .orElseThrow(() -> new ItemNotFoundException("Folder " + folderId + " not found"));
    }

    private FolderEntity findParentFolder(UUID parentFolderId) throws ItemNotFoundException {
        return folderRepository.findById(parentFolderId)
                .orElseThrow(() -> new ItemNotFoundException("Parent folder " + parentFolderId + " does not exist"));
    }

    private void requireTargetFolder(UUID folderId) throws ItemNotFoundException {
        if (folderId != null && !folderRepository.existsById(folderId)) {
            throw new ItemNotFoundException("Folder " + folderId + " not found");
        }
    }

    private void reparent(FolderEntity folder, UUID newParentId) throws ItemNotFoundException, ValidationFailedException {
        // Existence only; the cycle check loads and locks the parent's chain itself
        if (!folderRepository.existsById(newParentId)) {
            throw new ItemNotFoundException("Parent folder " + newParentId + " does not exist");
        }

        if (hierarchyValidator.wouldCreateCycle(folder.getFolderId(), newParentId)) {
            throw new ValidationFailedException("Cannot move folder: would create circular reference");
        }

        folder.setParentFolder(folderRepository.getReferenceById(newParentId));
    }

    // Breadth-first levels below the folder, nearest level first
    private List<List<UUID>> collectDescendantLevels(UUID folderId) {
        Map<UUID, List<UUID>> childrenByParent = new HashMap<>();
        for (FolderLink link : folderRepository.findAllLinks()) {
            if (link.getParentId() != null) {
                childrenByParent.computeIfAbsent(link.getParentId(), key -> new ArrayList<>()).add(link.getFolderId());
            }
        }

        List<List<UUID>> levels = new ArrayList<>();
        Set<UUID> visited = new HashSet<>();
        visited.add(folderId);
        List<UUID> current = List.of(folderId);
        while (!current.isEmpty()) {
            List<UUID> next = new ArrayList<>();
            for (UUID id : current) {
                for (UUID child : childrenByParent.getOrDefault(id, List.of())) {
                    if (visited.add(child)) {
                        next.add(child);
                    }
                }
            }
            if (!next.isEmpty()) {
                levels.add(next);
            }
            current = next;
        }
        return levels;
    }

    private Map<UUID, List<SourceInFolderResponse>> loadSourcesByFolder() {
        return sourceRepository.findByFolderIdIsNotNull().stream()
                .map(SourceInFolderResponse::from)
                .collect(Collectors.groupingBy(SourceInFolderResponse::getFolderId));
    }

    private void validateBatchMoveRequest(BatchMoveSourcesRequest request) throws ValidationFailedException {
        if (request == null || request.getSourceIds() == null || request.getSourceIds().isEmpty()) {
            throw new ValidationFailedException("At least one source must be selected for moving");
        }
        for (String sourceId : request.getSourceIds()) {
            if (sourceId == null || sourceId.isBlank()) {
                throw new ValidationFailedException("Source ids must not be blank");
            }
        }
    }

    private BatchMoveSourcesResponse.FailedOperation failure(String sourceId, String reason) {
        return BatchMoveSourcesResponse.FailedOperation.builder()
                .sourceId(sourceId)
                .reason(reason)
                .build();
    }

    private String buildMoveSummary(int moved, int failed, int total) {
        if (failed == 0) {
            return String.format("Moved %d of %d sources", moved, total);
        }
        return String.format("Moved %d of %d sources, %d failed", moved, total, failed);
    }

    private FolderResponse toFolderResponseWithCounts(FolderEntity folder) {
        UUID id = folder.getFolderId();
        return toFolderResponse(folder,
                aggregationEngine.directSourceCount(id),
                aggregationEngine.directSubfolderCount(id),
                aggregationEngine.totalSourceCount(id));
    }

    private FolderResponse toFolderResponse(FolderEntity folder, FolderCountSnapshot counts) {
        if (counts == null) {
            return toFolderResponse(folder, 0L, 0L, 0L);
        }
        UUID id = folder.getFolderId();
        return toFolderResponse(folder, counts.directSources(id), counts.directSubfolders(id), counts.totalSources(id));
    }

    private FolderResponse toFolderResponse(FolderEntity folder, long sourceCount, long subfolderCount, long totalSources) {
        return FolderResponse.builder()
                .id(folder.getFolderId())
                .parentId(folder.getParentFolderId())
                .name(folder.getName())
                .description(folder.getDescription())
                .color(folder.getColor())
                .icon(folder.getIcon())
                .position(folder.getPosition())
                .metadata(folder.getMetadata())
                .createdAt(folder.getCreatedAt())
                .updatedAt(folder.getUpdatedAt())
                .sourceCount(sourceCount)
                .subfolderCount(subfolderCount)
                .totalSources(totalSources)
                .build();
    }
}
