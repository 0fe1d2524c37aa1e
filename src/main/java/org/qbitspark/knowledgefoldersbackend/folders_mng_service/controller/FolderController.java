package org.qbitspark.knowledgefoldersbackend.folders_mng_service.controller;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.qbitspark.knowledgefoldersbackend.folders_mng_service.payload.*;
import org.qbitspark.knowledgefoldersbackend.folders_mng_service.service.FolderService;
import org.qbitspark.knowledgefoldersbackend.globeadvice.exceptions.ItemNotFoundException;
import org.qbitspark.knowledgefoldersbackend.globeadvice.exceptions.OperationFailedException;
import org.qbitspark.knowledgefoldersbackend.globeadvice.exceptions.ValidationFailedException;
import org.qbitspark.knowledgefoldersbackend.globeresponsebody.GlobeSuccessResponseBuilder;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/folders")
@RequiredArgsConstructor
@Slf4j
public class FolderController {

    private final FolderService folderService;

    @GetMapping
    public ResponseEntity<GlobeSuccessResponseBuilder> listFolders(
            @RequestParam(required = false) UUID parentId,
            @RequestParam(defaultValue = "true") boolean includeCounts) {

        log.info("Listing folders under parent: {}", parentId != null ? parentId : "root");

        List<FolderResponse> folders = folderService.listFolders(parentId, includeCounts);

        log.info("Found {} folders", folders.size());

        return ResponseEntity.ok(
                GlobeSuccessResponseBuilder.success("Folders retrieved successfully", folders)
        );
    }

    @GetMapping("/tree")
    public ResponseEntity<GlobeSuccessResponseBuilder> getFolderTree(
            @RequestParam(defaultValue = "false") boolean includeSources) {

        FolderTreeResponse response = folderService.getFolderTree(includeSources);

        log.info("Folder tree built with {} folders", response.getTotalFolders());

        return ResponseEntity.ok(
                GlobeSuccessResponseBuilder.success("Folder tree retrieved successfully", response)
        );
    }

    @GetMapping("/{folderId}")
    public ResponseEntity<GlobeSuccessResponseBuilder> getFolder(@PathVariable UUID folderId) throws ItemNotFoundException {

        FolderResponse response = folderService.getFolder(folderId)
                .orElseThrow(() -> new ItemNotFoundException("Folder " + folderId + " not found"));

        return ResponseEntity.ok(
                GlobeSuccessResponseBuilder.success("Folder retrieved successfully", response)
        );
    }

    @GetMapping("/{folderId}/contents")
    public ResponseEntity<GlobeSuccessResponseBuilder> getFolderContents(
            @PathVariable UUID folderId,
            @RequestParam(defaultValue = "true") boolean includeSources,
            @RequestParam(defaultValue = "true") boolean includeSubfolders) throws ItemNotFoundException {

        log.info("Getting contents for folder: {} (sources: {}, subfolders: {})",
                folderId, includeSources, includeSubfolders);

        FolderContentsResponse response = folderService.getFolderContents(folderId, includeSources, includeSubfolders)
                .orElseThrow(() -> new ItemNotFoundException("Folder " + folderId + " not found"));

        return ResponseEntity.ok(
                GlobeSuccessResponseBuilder.success("Folder contents retrieved successfully", response)
        );
    }

    @PostMapping
    public ResponseEntity<GlobeSuccessResponseBuilder> createFolder(
            @Valid @RequestBody CreateFolderRequest request) throws ItemNotFoundException {

        log.info("Creating folder: {} with parent: {}", request.getName(), request.getParentFolderId());

        FolderResponse response = folderService.createFolder(request);

        return ResponseEntity.ok(
                GlobeSuccessResponseBuilder.success("Folder created successfully", response)
        );
    }

    @PutMapping("/{folderId}")
    public ResponseEntity<GlobeSuccessResponseBuilder> updateFolder(
            @PathVariable UUID folderId,
            @Valid @RequestBody UpdateFolderRequest request) throws ItemNotFoundException, ValidationFailedException {

        FolderResponse response = folderService.updateFolder(folderId, request);

        return ResponseEntity.ok(
                GlobeSuccessResponseBuilder.success("Folder updated successfully", response)
        );
    }

    @PostMapping("/{folderId}/move")
    public ResponseEntity<GlobeSuccessResponseBuilder> moveFolder(
            @PathVariable UUID folderId,
            @RequestBody MoveFolderRequest request) throws ItemNotFoundException, ValidationFailedException {

        FolderResponse response = folderService.moveFolder(folderId, request.getNewParentId());

        return ResponseEntity.ok(
                GlobeSuccessResponseBuilder.success("Folder moved successfully", response)
        );
    }

    @DeleteMapping("/{folderId}")
    public ResponseEntity<GlobeSuccessResponseBuilder> deleteFolder(
            @PathVariable UUID folderId,
            @RequestParam(defaultValue = "true") boolean moveContentsToParent)
            throws ItemNotFoundException, OperationFailedException {

        DeleteFolderResponse response = folderService.deleteFolder(folderId, moveContentsToParent);

        log.info("Folder {} deleted - Folders moved: {}, Sources moved: {}, Folders deleted: {}, Sources deleted: {}",
                folderId, response.getFoldersMoved(), response.getSourcesMoved(),
                response.getFoldersDeleted(), response.getSourcesDeleted());

        return ResponseEntity.ok(
                GlobeSuccessResponseBuilder.success(response.getMessage(), response)
        );
    }
}
