package org.qbitspark.knowledgefoldersbackend.folders_mng_service.hierarchy;

import java.util.List;
import java.util.UUID;

/**
 * Recursive lookups over the folder forest. There are two implementations, one
 * running the walks in the application and one delegating to database functions;
 * for the same stored data both must return the same answers.
 */
public interface HierarchyQueries {

    /**
     * Whether {@code folderId} is {@code potentialAncestorId} or lies below it.
     *
     * <p>Every folder on the walked chain is locked for update until the surrounding
     * transaction ends, so two reparents whose chains cross cannot both pass the check.
     * Must be called inside a transaction.
     *
     * @throws HierarchyIntegrityException     if the ancestor chain of {@code folderId} hits a missing record
     * @throws HierarchyDepthExceededException if the chain exceeds the depth bound
     */
    boolean isDescendant(UUID folderId, UUID potentialAncestorId);

    /**
     * Folder names from the root down to {@code folderId}. A walk interrupted by a
     * missing record returns what it collected; an unknown folder yields an empty list.
     */
    List<String> folderPath(UUID folderId);

    /**
     * Sources in {@code folderId} and every folder below it. Zero for an unknown folder.
     */
    long totalSourceCount(UUID folderId);
}
