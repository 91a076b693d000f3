package com.example.xtractor.application.service;

import com.example.xtractor.application.exception.JsonExportValidationException;
import com.example.xtractor.config.ExportProperties;
import com.example.xtractor.domain.model.BoundaryDocument;
import com.example.xtractor.infrastructure.exception.JsonExportException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Writes and reads the external {@code states/lgas/wards} JSON form of a {@link BoundaryDocument}.
 */
@Service
public class JsonExportService {

    private static final Logger log = LoggerFactory.getLogger(JsonExportService.class);
    private static final DateTimeFormatter FILE_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final ObjectMapper objectMapper;
    private final ExportProperties properties;

    /**
     * @param objectMapper Spring-managed Jackson mapper
     * @param properties   export settings
     */
    public JsonExportService(ObjectMapper objectMapper, ExportProperties properties) {
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    /**
     * Serializes a document.
     *
     * @param document extracted document
     * @return JSON text
     * @throws JsonExportValidationException when there is no document
     */
    public String toJson(BoundaryDocument document) {
        if (document == null) {
            throw new JsonExportValidationException("No extracted document available for export.");
        }
        try {
            return writer().writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new JsonExportException("Unable to serialize the extracted document.", e);
        }
    }

    /**
     * Parses a document previously written by {@link #toJson(BoundaryDocument)}.
     *
     * @param json JSON text
     * @return rebuilt document
     */
    public BoundaryDocument fromJson(String json) {
        if (json == null || json.isBlank()) {
            throw new JsonExportValidationException("JSON payload is empty.");
        }
        try {
            return objectMapper.readValue(json, BoundaryDocument.class);
        } catch (JsonProcessingException e) {
            throw new JsonExportException("Unable to parse the boundary JSON document.", e);
        }
    }

    /**
     * Writes the document to the configured output directory as
     * {@code <source base name>_extracted_<yyyyMMdd_HHmmss>.json}.
     *
     * @param document       extracted document
     * @param sourceFileName name of the PDF the document came from
     * @return path of the written file
     */
    public Path save(BoundaryDocument document, String sourceFileName) {
        String json = toJson(document);
        Path target = outputDirectory().resolve(exportFileName(sourceFileName));
        try {
            Files.createDirectories(target.getParent());
            Files.writeString(target, json, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new JsonExportException("Unable to write " + target, e);
        }
        log.info("Data saved to {}", target);
        return target;
    }

    /**
     * @param sourceFileName original PDF name, may be {@code null}
     * @return export file name derived from the PDF name and the current time
     */
    String exportFileName(String sourceFileName) {
        String base = sourceFileName == null || sourceFileName.isBlank() ? "boundaries" : sourceFileName;
        int slash = Math.max(base.lastIndexOf('/'), base.lastIndexOf('\\'));
        if (slash >= 0) {
            base = base.substring(slash + 1);
        }
        int dot = base.lastIndexOf('.');
        if (dot > 0) {
            base = base.substring(0, dot);
        }
        return base + "_extracted_" + LocalDateTime.now().format(FILE_TIMESTAMP) + ".json";
    }

    /**
     * @return absolute output directory; a blank setting means the working directory
     */
    private Path outputDirectory() {
        String outputDir = properties.getOutputDir();
        Path directory = outputDir == null || outputDir.isBlank() ? Path.of("") : Path.of(outputDir.strip());
        return directory.toAbsolutePath();
    }

    private ObjectWriter writer() {
        return properties.isPrettyPrint()
                ? objectMapper.writerWithDefaultPrettyPrinter()
                : objectMapper.writer();
    }
}
