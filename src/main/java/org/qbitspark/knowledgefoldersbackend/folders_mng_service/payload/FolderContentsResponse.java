package org.qbitspark.knowledgefoldersbackend.folders_mng_service.payload;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class FolderContentsResponse {

    private FolderResponse folder;

    // Immediate contents only
    private List<FolderResponse> subfolders;
    private List<SourceInFolderResponse> sources;

    // Folder names from root down to this folder
    private List<String> path;
}
