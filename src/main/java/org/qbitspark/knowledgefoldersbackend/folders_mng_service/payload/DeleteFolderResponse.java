package org.qbitspark.knowledgefoldersbackend.folders_mng_service.payload;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class DeleteFolderResponse {

    private UUID folderId;
    private String folderName;
    private boolean movedToParent;

    // Where promoted contents went, null for root
    private UUID newParentId;

    private int foldersMoved;
    private int sourcesMoved;
    private int foldersDeleted;
    private int sourcesDeleted;

    private String message;
}
