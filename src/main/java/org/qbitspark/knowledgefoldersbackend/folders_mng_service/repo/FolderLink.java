package org.qbitspark.knowledgefoldersbackend.folders_mng_service.repo;

import java.util.UUID;

/**
 * Id, parent id and name of a folder, without loading the entity.
 */
public interface FolderLink {
    UUID getFolderId();

    UUID getParentId();

    String getName();
}
