package org.qbitspark.knowledgefoldersbackend.folders_mng_service.hierarchy;

/**
 * The stored parent references contain a cycle, so some folders cannot be reached from any root.
 */
public class HierarchyCorruptedException extends HierarchyIntegrityException {
    public HierarchyCorruptedException(String message) {
        super(message);
    }
}
