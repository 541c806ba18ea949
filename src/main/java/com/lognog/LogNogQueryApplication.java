package com.lognog;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the LogNog query compiler service.
 *
 * Compiles the pipe-based LogNog search language into SQL for the log store
 * and serves the DSL reference to the query editor. Query execution happens
 * elsewhere; this service never touches the database.
 */
@SpringBootApplication
public class LogNogQueryApplication {

    /**
     * Main entry point for the LogNog query compiler.
     *
     * @param args command line arguments
     */
    public static void main(String[] args) {
        SpringApplication.run(LogNogQueryApplication.class, args);
    }
}
