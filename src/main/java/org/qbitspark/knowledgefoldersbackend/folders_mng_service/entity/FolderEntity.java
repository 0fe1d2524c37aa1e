package org.qbitspark.knowledgefoldersbackend.folders_mng_service.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

@Entity
@Table(name = "knowledge_folders", indexes = {
        @Index(name = "idx_knowledge_folders_parent_id", columnList = "parent_id"),
        @Index(name = "idx_knowledge_folders_parent_position", columnList = "parent_id, position")
})
@Getter
@Setter
@NoArgsConstructor
public class FolderEntity {
    @Id
    @GeneratedValue(strategy = GenerationType.AUTO)
    private UUID folderId;

    @Column(nullable = false, length = 255)
    private String name;

    @Column(length = 2000)
    private String description;

    // Self-referencing relationship for hierarchy, null means root level
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "parent_id")
    private FolderEntity parentFolder;

    @Column(length = 7)
    private String color;

    private String icon;

    @Column(nullable = false)
    private int position = 0;

    @Convert(converter = MetadataJsonConverter.class)
    @Column(name = "metadata", length = 8192)
    private Map<String, Object> metadata = new HashMap<>();

    @CreationTimestamp
    private LocalDateTime createdAt;

    @UpdateTimestamp
    private LocalDateTime updatedAt;

    @Version
    private Long version;

    public UUID getParentFolderId() {
        return parentFolder != null ? parentFolder.getFolderId() : null;
    }
}
