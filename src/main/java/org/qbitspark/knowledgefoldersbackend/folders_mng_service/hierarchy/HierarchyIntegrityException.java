package org.qbitspark.knowledgefoldersbackend.folders_mng_service.hierarchy;

/**
 * Raised when stored parent references cannot be traversed safely. Thrown as is
 * for a missing record in the middle of an ancestor walk; the depth bound and
 * stored cycles have their own subclasses.
 */
public class HierarchyIntegrityException extends RuntimeException {
    public HierarchyIntegrityException(String message) {
        super(message);
    }
}
