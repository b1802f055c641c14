package com.ragward;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for Ragward - resilient request mediation for document Q&A.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class RagwardApplication {

    public static void main(String[] args) {
        SpringApplication.run(RagwardApplication.class, args);
    }
}
