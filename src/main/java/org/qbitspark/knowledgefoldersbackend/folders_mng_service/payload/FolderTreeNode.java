package org.qbitspark.knowledgefoldersbackend.folders_mng_service.payload;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class FolderTreeNode implements FolderTreeItem {
    private UUID id;
    private UUID parentId;
    private String name;
    private String description;
    private String color;
    private String icon;
    private int position;
    private Map<String, Object> metadata;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
    private long sourceCount;
    private long subfolderCount;
    private long totalSources;

    // Child folders first, then source leaves
    @Builder.Default
    private List<FolderTreeItem> children = new ArrayList<>();

    @Override
    public String getNodeType() {
        return "folder";
    }
}
