package com.example.xtractor.config;

import com.example.xtractor.application.extraction.HierarchyExtractionEngine;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the framework-free extraction engine into the Spring context.
 */
@Configuration
public class ExtractionEngineConfig {

    @Bean
    public HierarchyExtractionEngine hierarchyExtractionEngine(ExtractionProperties properties) {
        return new HierarchyExtractionEngine(properties.toSettings());
    }
}
