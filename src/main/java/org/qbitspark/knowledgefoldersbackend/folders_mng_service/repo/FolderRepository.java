package org.qbitspark.knowledgefoldersbackend.folders_mng_service.repo;

import jakarta.persistence.LockModeType;
import org.qbitspark.knowledgefoldersbackend.folders_mng_service.entity.FolderEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface FolderRepository extends JpaRepository<FolderEntity, UUID> {

    // Root folders (parentFolder is null); callers sort with SiblingOrder
    List<FolderEntity> findByParentFolderIsNull();

    List<FolderEntity> findByParentFolder_FolderId(UUID parentFolderId);

    long countByParentFolder_FolderId(UUID parentFolderId);

    // Row lock held for the rest of the mutating transaction
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select f from FolderEntity f where f.folderId = :folderId")
    Optional<FolderEntity> findForUpdate(@Param("folderId") UUID folderId);

    @Query("select f.folderId as folderId, p.folderId as parentId, f.name as name "
            + "from FolderEntity f left join f.parentFolder p where f.folderId = :folderId")
    Optional<FolderLink> findLinkByFolderId(@Param("folderId") UUID folderId);

    @Query("select f.folderId as folderId, p.folderId as parentId, f.name as name "
            + "from FolderEntity f left join f.parentFolder p")
    List<FolderLink> findAllLinks();

    @Modifying(flushAutomatically = true)
    @Query("delete from FolderEntity f where f.folderId in :folderIds")
    int deleteAllByFolderIdIn(@Param("folderIds") Collection<UUID> folderIds);

    // Pending entity changes are flushed first and the persistence context is cleared afterwards
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from FolderEntity f where f.folderId = :folderId")
    int removeByFolderId(@Param("folderId") UUID folderId);
}
