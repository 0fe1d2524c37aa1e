package org.qbitspark.knowledgefoldersbackend.folders_mng_service.repo;

import org.qbitspark.knowledgefoldersbackend.folders_mng_service.entity.KnowledgeSourceEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface KnowledgeSourceRepository extends JpaRepository<KnowledgeSourceEntity, String> {

    // Sources directly in a folder, newest first
    List<KnowledgeSourceEntity> findByFolderIdOrderByCreatedAtDesc(UUID folderId);

    List<KnowledgeSourceEntity> findByFolderIdIsNotNull();

    long countByFolderId(UUID folderId);

    @Query("select s.folderId as folderId, count(s) as sourceCount from KnowledgeSourceEntity s "
            + "where s.folderId is not null group by s.folderId")
    List<FolderSourceCount> countGroupedByFolder();

    @Modifying(flushAutomatically = true)
    @Query("update KnowledgeSourceEntity s set s.folderId = :targetFolderId where s.sourceId = :sourceId")
    int assignFolder(@Param("sourceId") String sourceId, @Param("targetFolderId") UUID targetFolderId);

    @Modifying(flushAutomatically = true)
    @Query("update KnowledgeSourceEntity s set s.folderId = :targetFolderId where s.folderId = :folderId")
    int reassignFolder(@Param("folderId") UUID folderId, @Param("targetFolderId") UUID targetFolderId);

    @Modifying(flushAutomatically = true)
    @Query("delete from KnowledgeSourceEntity s where s.folderId in :folderIds")
    int deleteByFolderIdIn(@Param("folderIds") Collection<UUID> folderIds);
}
