package org.qbitspark.knowledgefoldersbackend.folders_mng_service.payload;

import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.Map;
import java.util.UUID;

/**
 * Partial update. Only non-null fields are applied; a null {@code parentFolderId}
 * leaves the folder where it is (use the move endpoint to move a folder to root).
 */
@Getter
@Setter
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class UpdateFolderRequest {

    @Size(min = 1, max = 255, message = "Folder name must be between 1 and 255 characters")
    private String name;

    private String description;

    @Pattern(regexp = "^#[0-9a-fA-F]{6}$", message = "Color must be a hex code such as #00ff41")
    private String color;

    private String icon;

    private Integer position;

    private UUID parentFolderId;

    private Map<String, Object> metadata;

    public boolean hasChanges() {
        return name != null || description != null || color != null || icon != null
                || position != null || parentFolderId != null || metadata != null;
    }
}
