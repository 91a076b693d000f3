package com.example.xtractor.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for the JSON export of extracted documents.
 */
@Component
@ConfigurationProperties(prefix = "xtractor.export")
public class ExportProperties {

    /**
     * Directory receiving {@code *_extracted_<timestamp>.json} files.
     */
    private String outputDir = "extracted_data";

    private boolean prettyPrint = true;

    public String getOutputDir() {
        return outputDir;
    }

    public void setOutputDir(String outputDir) {
        this.outputDir = outputDir;
    }

    public boolean isPrettyPrint() {
        return prettyPrint;
    }

    public void setPrettyPrint(boolean prettyPrint) {
        this.prettyPrint = prettyPrint;
    }
}
