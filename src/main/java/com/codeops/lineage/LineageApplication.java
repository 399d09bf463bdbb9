package com.codeops.lineage;

import com.codeops.lineage.config.LineageProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * CodeOps-Lineage application entry point. Branching, commit history and merge requests
 * for activity module content.
 */
@SpringBootApplication
@EnableConfigurationProperties(LineageProperties.class)
public class LineageApplication {

    public static void main(String[] args) {
        SpringApplication.run(LineageApplication.class, args);
    }
}
