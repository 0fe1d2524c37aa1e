package org.qbitspark.knowledgefoldersbackend.folders_mng_service.hierarchy;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.stereotype.Component;

import java.util.UUID;

@Component
@RequiredArgsConstructor
@Slf4j
public class HierarchyValidator {

    private final HierarchyQueries hierarchyQueries;

    /**
     * Whether making {@code candidateParentId} the parent of {@code folderId} would
     * make the folder its own ancestor. Any failure while walking the ancestors of
     * the candidate counts as a cycle, so an unverified move is never allowed. Lock
     * conflicts with a concurrent reparent are rethrown so the transaction rolls back.
     */
    public boolean wouldCreateCycle(UUID folderId, UUID candidateParentId) {
        if (folderId == null || candidateParentId == null) {
            return false;
        }
        if (folderId.equals(candidateParentId)) {
            return true;
        }
        try {
            return hierarchyQueries.isDescendant(candidateParentId, folderId);
        } catch (ConcurrencyFailureException e) {
            log.warn("Cycle check for folder {} under {} lost a lock race: {}",
                    folderId, candidateParentId, e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            log.warn("Cycle check for folder {} under {} failed, rejecting the move: {}",
                    folderId, candidateParentId, e.getMessage());
            return true;
        }
    }
}
