package org.qbitspark.knowledgefoldersbackend.folders_mng_service.hierarchy;

import lombok.extern.slf4j.Slf4j;
import org.qbitspark.knowledgefoldersbackend.folders_mng_service.repo.FolderRepository;
import org.qbitspark.knowledgefoldersbackend.folders_mng_service.repo.KnowledgeSourceRepository;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * Chooses the {@link HierarchyQueries} implementation once, at startup.
 */
@Configuration
@EnableConfigurationProperties(HierarchyProperties.class)
@Slf4j
public class HierarchyQueriesConfig {

    static final String FUNCTION_LOOKUP_SQL = "select count(distinct proname) from pg_proc where proname in "
            + "('knowledge_is_folder_descendant', 'knowledge_get_folder_path', 'knowledge_count_folder_sources')";
    static final int REQUIRED_FUNCTIONS = 3;

    @Bean
    public HierarchyQueries hierarchyQueries(HierarchyProperties properties,
                                             FolderRepository folderRepository,
                                             KnowledgeSourceRepository sourceRepository,
                                             JdbcTemplate jdbcTemplate) {
        boolean useDatabase = switch (properties.getFunctions()) {
            case DATABASE -> true;
            case CLIENT -> false;
            case AUTO -> databaseFunctionsAvailable(jdbcTemplate);
        };

        if (useDatabase) {
            log.info("Hierarchy lookups use database functions (max depth {})", properties.getMaxDepth());
            return new DatabaseFunctionHierarchyQueries(jdbcTemplate, properties);
        }
        log.info("Hierarchy lookups run client-side (max depth {})", properties.getMaxDepth());
        return new ClientSideHierarchyQueries(folderRepository, sourceRepository, properties);
    }

    static boolean databaseFunctionsAvailable(JdbcTemplate jdbcTemplate) {
        try {
            Integer found = jdbcTemplate.queryForObject(FUNCTION_LOOKUP_SQL, Integer.class);
            return found != null && found == REQUIRED_FUNCTIONS;
        } catch (DataAccessException e) {
            log.info("Hierarchy database functions not available: {}", e.getMessage());
            return false;
        }
    }
}
