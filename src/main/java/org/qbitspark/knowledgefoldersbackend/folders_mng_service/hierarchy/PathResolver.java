package org.qbitspark.knowledgefoldersbackend.folders_mng_service.hierarchy;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.UUID;

@Component
@RequiredArgsConstructor
public class PathResolver {

    private final HierarchyQueries hierarchyQueries;

    // Root first; shorter than the real depth when a stored parent is missing
    public List<String> pathTo(UUID folderId) {
        if (folderId == null) {
            return List.of();
        }
        return hierarchyQueries.folderPath(folderId);
    }
}
