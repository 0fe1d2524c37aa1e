package org.qbitspark.knowledgefoldersbackend.folders_mng_service.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * A knowledge source as seen by the folder hierarchy. The record is owned by the
 * ingestion side; folder management only ever rewrites {@code folderId} or removes
 * the row during a cascading folder delete.
 */
@Entity
@Table(name = "knowledge_sources", indexes = {
        @Index(name = "idx_knowledge_sources_folder_id", columnList = "folder_id")
})
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class KnowledgeSourceEntity {
    @Id
    private String sourceId;

    private String title;

    @Column(length = 2048)
    private String sourceUrl;

    private String sourceDisplayName;

    // null means root level
    @Column(name = "folder_id")
    private UUID folderId;

    @Convert(converter = MetadataJsonConverter.class)
    @Column(name = "metadata", length = 8192)
    private Map<String, Object> metadata = new HashMap<>();

    @CreationTimestamp
    private LocalDateTime createdAt;
}
