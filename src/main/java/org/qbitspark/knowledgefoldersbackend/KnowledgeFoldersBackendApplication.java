package org.qbitspark.knowledgefoldersbackend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class KnowledgeFoldersBackendApplication {

    public static void main(String[] args) {
        SpringApplication.run(KnowledgeFoldersBackendApplication.class, args);
    }
}
