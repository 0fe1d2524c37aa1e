package org.qbitspark.knowledgefoldersbackend.folders_mng_service.payload;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.qbitspark.knowledgefoldersbackend.folders_mng_service.entity.KnowledgeSourceEntity;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class SourceInFolderResponse implements FolderTreeItem {
    private String id;
    private String sourceId;
    private String title;
    private String sourceUrl;
    private String sourceDisplayName;
    private UUID folderId;
    private LocalDateTime createdAt;

    // From the source metadata bag
    private String knowledgeType;
    private List<String> tags;

    @Override
    public String getNodeType() {
        return "source";
    }

    public static SourceInFolderResponse from(KnowledgeSourceEntity source) {
        Map<String, Object> metadata = source.getMetadata() != null ? source.getMetadata() : Map.of();

        Object knowledgeType = metadata.get("knowledge_type");
        List<String> tags = List.of();
        if (metadata.get("tags") instanceof List<?> rawTags) {
            tags = rawTags.stream()
                    .filter(Objects::nonNull)
                    .map(Object::toString)
                    .toList();
        }

        return SourceInFolderResponse.builder()
                .id(source.getSourceId())
                .sourceId(source.getSourceId())
                .title(source.getTitle())
                .sourceUrl(source.getSourceUrl())
                .sourceDisplayName(source.getSourceDisplayName())
                .folderId(source.getFolderId())
                .createdAt(source.getCreatedAt())
                .knowledgeType(knowledgeType != null ? knowledgeType.toString() : null)
                .tags(tags)
                .build();
    }
}
