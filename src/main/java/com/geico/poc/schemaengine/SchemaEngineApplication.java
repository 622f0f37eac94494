package com.geico.poc.schemaengine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point for the schema engine.
 *
 * Hosts the schema, index and snapshot managers on top of a single SQLite store.
 */
@SpringBootApplication
public class SchemaEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(SchemaEngineApplication.class, args);
    }
}
