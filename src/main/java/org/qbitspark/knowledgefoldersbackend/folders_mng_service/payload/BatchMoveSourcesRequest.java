package org.qbitspark.knowledgefoldersbackend.folders_mng_service.payload;

import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.UUID;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class BatchMoveSourcesRequest {

    @NotEmpty(message = "At least one source must be selected for moving")
    private List<String> sourceIds;

    private UUID folderId; // null means root level
}
