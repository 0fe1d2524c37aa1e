package org.qbitspark.knowledgefoldersbackend.folders_mng_service.payload;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.UUID;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class BatchMoveSourcesResponse {

    private int totalSourcesRequested;
    private int successfulMoves;
    private int failedMoves;

    // Details of successful operations
    private List<String> movedSourceIds;

    // Details of failed operations
    private List<FailedOperation> failures;

    private UUID folderId;
    private String summary;

    @Data
    @Builder
    @AllArgsConstructor
    @NoArgsConstructor
    public static class FailedOperation {
        private String sourceId;
        private String reason;
    }
}
