package org.qbitspark.knowledgefoldersbackend.folders_mng_service.repo;

import java.util.UUID;

public interface FolderSourceCount {
    UUID getFolderId();

    Long getSourceCount();
}
