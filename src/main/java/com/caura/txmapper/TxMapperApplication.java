package com.caura.txmapper;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * Main Spring Boot application class for the transaction mapper.
 *
 * Resolves imported payment transactions to registry clients:
 * - Indexed, atomically reloadable client registry
 * - Ordered matching cascade with confidence banding and review flags
 * - Post-review resolution from extracted PII with email propagation
 * - Persisted reconciliation runs with summaries
 * - OpenAPI/Swagger documentation
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@EnableTransactionManagement
public class TxMapperApplication {

    public static void main(String[] args) {
        SpringApplication.run(TxMapperApplication.class, args);
    }
}
