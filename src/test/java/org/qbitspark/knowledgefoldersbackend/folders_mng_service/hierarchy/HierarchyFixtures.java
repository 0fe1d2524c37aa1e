package org.qbitspark.knowledgefoldersbackend.folders_mng_service.hierarchy;

import org.qbitspark.knowledgefoldersbackend.folders_mng_service.entity.FolderEntity;
import org.qbitspark.knowledgefoldersbackend.folders_mng_service.repo.FolderLink;
import org.qbitspark.knowledgefoldersbackend.folders_mng_service.repo.FolderSourceCount;

import java.util.Optional;
import java.util.UUID;

final class HierarchyFixtures {

    private HierarchyFixtures() {
    }

    static FolderLink link(UUID folderId, UUID parentId, String name) {
        return new FolderLink() {
            @Override
            public UUID getFolderId() {
                return folderId;
            }

            @Override
            public UUID getParentId() {
                return parentId;
            }

            @Override
            public String getName() {
                return name;
            }
        };
    }

    static FolderSourceCount sources(UUID folderId, long count) {
        return new FolderSourceCount() {
            @Override
            public UUID getFolderId() {
                return folderId;
            }

            @Override
            public Long getSourceCount() {
                return count;
            }
        };
    }

    static FolderEntity folder(UUID id, FolderEntity parent, String name, int position) {
        FolderEntity folder = new FolderEntity();
        folder.setFolderId(id);
        folder.setParentFolder(parent);
        folder.setName(name);
        folder.setPosition(position);
        return folder;
    }

    // Entity whose parent reference carries only the parent id, as a lazy proxy would
    static Optional<FolderEntity> stored(UUID id, UUID parentId) {
        FolderEntity parent = parentId != null ? folder(parentId, null, null, 0) : null;
        return Optional.of(folder(id, parent, null, 0));
    }
}
