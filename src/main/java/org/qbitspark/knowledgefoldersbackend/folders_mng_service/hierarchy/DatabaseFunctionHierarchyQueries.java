package org.qbitspark.knowledgefoldersbackend.folders_mng_service.hierarchy;

import com.google.common.collect.ImmutableList;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;

import java.sql.Array;
import java.util.List;
import java.util.UUID;

/**
 * Delegates the recursive lookups to the PostgreSQL functions installed by
 * {@code schema-postgresql.sql}. The functions raise on a missing ancestor or an
 * exhausted depth bound, which surfaces here as a {@code DataAccessException}.
 */
@RequiredArgsConstructor
public class DatabaseFunctionHierarchyQueries implements HierarchyQueries {

    static final String IS_DESCENDANT_SQL = "select knowledge_is_folder_descendant(?, ?, ?)";
    static final String FOLDER_PATH_SQL = "select knowledge_get_folder_path(?, ?)";
    static final String TOTAL_SOURCES_SQL = "select knowledge_count_folder_sources(?)";

    private final JdbcTemplate jdbcTemplate;
    private final HierarchyProperties properties;

    @Override
    public boolean isDescendant(UUID folderId, UUID potentialAncestorId) {
        if (folderId == null || potentialAncestorId == null) {
            return false;
        }
        Boolean result = jdbcTemplate.queryForObject(IS_DESCENDANT_SQL, Boolean.class,
                folderId, potentialAncestorId, properties.getMaxDepth());
        if (result == null) {
            throw new HierarchyIntegrityException("Descendant check returned no result for folder " + folderId);
        }
        return result;
    }

    @Override
    public List<String> folderPath(UUID folderId) {
        List<String> path = jdbcTemplate.query(FOLDER_PATH_SQL, rs -> {
            if (!rs.next()) {
                return List.of();
            }
            Array names = rs.getArray(1);
            if (names == null) {
                return List.of();
            }
            try {
                return List.of((String[]) names.getArray());
            } finally {
                names.free();
            }
        }, folderId, properties.getMaxDepth());
        return path != null ? ImmutableList.copyOf(path) : ImmutableList.of();
    }

    @Override
    public long totalSourceCount(UUID folderId) {
        Long total = jdbcTemplate.queryForObject(TOTAL_SOURCES_SQL, Long.class, folderId);
        return total != null ? total : 0L;
    }
}
