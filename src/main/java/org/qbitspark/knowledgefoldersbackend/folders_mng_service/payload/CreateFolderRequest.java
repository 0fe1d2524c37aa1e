package org.qbitspark.knowledgefoldersbackend.folders_mng_service.payload;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.Map;
import java.util.UUID;

@Getter
@Setter
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class CreateFolderRequest {

    @NotBlank(message = "Folder name is required")
    @Size(min = 1, max = 255, message = "Folder name must be between 1 and 255 characters")
    private String name;

    private String description;

    @Pattern(regexp = "^#[0-9a-fA-F]{6}$", message = "Color must be a hex code such as #00ff41")
    private String color;

    private String icon;

    // Sort order within the parent, 0 when omitted
    private Integer position;

    private Map<String, Object> metadata;

    // Optional: null means root level folder
    private UUID parentFolderId;
}
