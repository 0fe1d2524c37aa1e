package org.qbitspark.knowledgefoldersbackend.folders_mng_service.hierarchy;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Getter
@Setter
@ConfigurationProperties(prefix = "knowledge.folders.hierarchy")
public class HierarchyProperties {

    /**
     * Upper bound on ancestor walks (cycle check and path resolution).
     */
    private int maxDepth = 100;

    /**
     * Which {@link HierarchyQueries} implementation to use.
     */
    private FunctionsMode functions = FunctionsMode.AUTO;

    public enum FunctionsMode {
        // check the database for the functions at startup
        AUTO,
        DATABASE,
        CLIENT
    }
}
