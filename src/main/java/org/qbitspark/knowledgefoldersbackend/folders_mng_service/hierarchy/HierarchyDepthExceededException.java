package org.qbitspark.knowledgefoldersbackend.folders_mng_service.hierarchy;

public class HierarchyDepthExceededException extends HierarchyIntegrityException {
    public HierarchyDepthExceededException(String message) {
        super(message);
    }
}
