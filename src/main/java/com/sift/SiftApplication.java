package com.sift;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the Sift query compiler.
 *
 * Sift compiles strongly-typed query call chains (filters, projections, sorts,
 * limits and aggregation stages) into the text protocols of a search and
 * aggregation engine:
 * - search query strings with sort, projection, limit and geo options
 * - ordered aggregation pipelines of group, reduce, sort, apply and filter stages
 *
 * Index declarations are loaded from YAML at startup; compilers are stateless
 * singletons shared across threads.
 */
@SpringBootApplication
public class SiftApplication {

    /**
     * Main entry point for the Sift application.
     *
     * @param args command line arguments
     */
    public static void main(String[] args) {
        SpringApplication.run(SiftApplication.class, args);
    }
}
