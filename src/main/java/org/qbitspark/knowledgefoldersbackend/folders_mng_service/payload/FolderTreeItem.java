package org.qbitspark.knowledgefoldersbackend.folders_mng_service.payload;

/**
 * Element of a folder tree's children list: a folder node or a source leaf.
 */
public interface FolderTreeItem {
    String getNodeType();
}
