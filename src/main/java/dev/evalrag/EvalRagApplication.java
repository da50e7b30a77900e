package dev.evalrag;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Entry point for the EvalRAG application.
 *
 * <p>Runs as an MCP server over stdio: answers questions over the indexed corpus and drives
 * evaluation runs against curated datasets.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class EvalRagApplication {
    public static void main(String[] args) {
        SpringApplication.run(EvalRagApplication.class, args);
    }
}
