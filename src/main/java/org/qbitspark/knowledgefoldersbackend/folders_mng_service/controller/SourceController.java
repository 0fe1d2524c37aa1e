package org.qbitspark.knowledgefoldersbackend.folders_mng_service.controller;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.qbitspark.knowledgefoldersbackend.folders_mng_service.payload.BatchMoveSourcesRequest;
import org.qbitspark.knowledgefoldersbackend.folders_mng_service.payload.BatchMoveSourcesResponse;
import org.qbitspark.knowledgefoldersbackend.folders_mng_service.payload.MoveSourceRequest;
import org.qbitspark.knowledgefoldersbackend.folders_mng_service.payload.MoveSourceResponse;
import org.qbitspark.knowledgefoldersbackend.folders_mng_service.service.FolderService;
import org.qbitspark.knowledgefoldersbackend.globeadvice.exceptions.ItemNotFoundException;
import org.qbitspark.knowledgefoldersbackend.globeadvice.exceptions.ValidationFailedException;
import org.qbitspark.knowledgefoldersbackend.globeresponsebody.GlobeSuccessResponseBuilder;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/sources")
@RequiredArgsConstructor
@Slf4j
public class SourceController {

    private final FolderService folderService;

    @PostMapping("/{sourceId}/move")
    public ResponseEntity<GlobeSuccessResponseBuilder> moveSource(
            @PathVariable String sourceId,
            @RequestBody MoveSourceRequest request) throws ItemNotFoundException {

        MoveSourceResponse response = folderService.moveSource(sourceId, request.getFolderId());

        return ResponseEntity.ok(
                GlobeSuccessResponseBuilder.success(response.getMessage(), response)
        );
    }

    @PostMapping("/batch-move")
    public ResponseEntity<GlobeSuccessResponseBuilder> batchMoveSources(
            @Valid @RequestBody BatchMoveSourcesRequest request) throws ItemNotFoundException, ValidationFailedException {

        BatchMoveSourcesResponse response = folderService.batchMoveSources(request);

        log.info("Batch move completed - Moved: {}, Failed: {}", response.getSuccessfulMoves(), response.getFailedMoves());

        return ResponseEntity.ok(
                GlobeSuccessResponseBuilder.success(response.getSummary(), response)
        );
    }
}
