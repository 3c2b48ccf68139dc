package com.ruian;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main entry point for the piece-rate production backend.
 *
 * This Spring Boot application provides a REST API for:
 * - Username/password login with JWT bearer tokens
 * - Importing production order configuration and employee worklogs
 * - Validating worklogs against the production configuration and computing
 *   performance amounts (quantity × performance factor)
 * - Paged queries and date-range re-validation reports
 *
 * Data lives in PostgreSQL; the schema is applied from db/schema.sql at start-up.
 */
@SpringBootApplication
public class RuianBackendApplication {

    public static void main(String[] args) {
        SpringApplication.run(RuianBackendApplication.class, args);
    }
}
