package com.example.xtractor.application.service;

import com.example.xtractor.application.exception.JsonExportValidationException;
import com.example.xtractor.config.ExportProperties;
import com.example.xtractor.domain.model.BoundaryDocument;
import com.example.xtractor.domain.model.LgaNode;
import com.example.xtractor.domain.model.StateNode;
import com.example.xtractor.domain.model.WardNode;
import com.example.xtractor.infrastructure.exception.JsonExportException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for the JSON form of extracted documents.
 */
class JsonExportServiceTest {

    @TempDir
    Path outputDir;

    private ExportProperties properties;
    private JsonExportService service;

    @BeforeEach
    void setUp() {
        properties = new ExportProperties();
        properties.setOutputDir(outputDir.toString());
        properties.setPrettyPrint(false);
        service = new JsonExportService(new ObjectMapper(), properties);
    }

    /**
     * Ensures the serialized form uses the nested {@code states/lgas/wards} layout.
     */
    @Test
    void toJsonUsesStatesLgasWardsLayout() {
        BoundaryDocument document = new BoundaryDocument();
        document.addState(state("ABIA", lga("ABA NORTH", "01", ward("EZIAMA", "01"))));

        String json = service.toJson(document);

        assertThat(json).isEqualTo("{\"states\":[{\"name\":\"ABIA\",\"lgas\":[{\"name\":\"ABA NORTH\","
                + "\"code\":\"01\",\"wards\":[{\"name\":\"EZIAMA\",\"code\":\"01\"}]}]}]}");
    }

    /**
     * Ensures parsing restores every node at every level in its original order.
     */
    @Test
    void fromJsonRestoresWhatToJsonWrote() {
        BoundaryDocument original = multiStateDocument();

        BoundaryDocument restored = service.fromJson(service.toJson(original));

        assertThat(outline(restored)).isEqualTo(outline(original));
        assertThat(outline(restored)).containsExactly(
                "ABIA",
                "ABIA/ABA NORTH/01",
                "ABIA/ABA NORTH/01/EZIAMA/01",
                "ABIA/ABA NORTH/01/ARIARIA/02",
                "ABIA/OHAFIA/09",
                "ABIA/OHAFIA/09/AMAEKPU/03",
                "ABIA/OHAFIA/09/ABIRIBA/01",
                "IMO",
                "IMO/OWERRI WEST/17",
                "IMO/OWERRI WEST/17/NEKEDE/05",
                "IMO/OWERRI WEST/17/IHIAGWA/04",
                "IMO/ORLU/12",
                "IMO/ORLU/12/UMUTANZE/02",
                "IMO/ORLU/12/OHAFOR/01");
    }

    /**
     * Ensures pretty printing changes layout only, never content.
     */
    @Test
    void prettyPrintedJsonParsesToTheSameDocument() {
        properties.setPrettyPrint(true);
        BoundaryDocument original = multiStateDocument();

        String json = service.toJson(original);

        assertThat(json).contains("\n");
        assertThat(outline(service.fromJson(json))).isEqualTo(outline(original));
    }

    /**
     * Ensures the file lands in the output directory under the source-derived name.
     *
     * @throws Exception when the written file cannot be read back
     */
    @Test
    void saveWritesTimestampedFile() throws Exception {
        Path written = service.save(multiStateDocument(), "uploads/INEC Abia.pdf");

        assertThat(written.getParent()).isEqualTo(outputDir.toAbsolutePath());
        assertThat(written.getFileName().toString()).matches("INEC Abia_extracted_\\d{8}_\\d{6}\\.json");
        assertThat(Files.readString(written, StandardCharsets.UTF_8)).contains("\"ABA NORTH\"");
    }

    /**
     * Ensures a blank output directory writes into the working directory instead of failing.
     *
     * @throws Exception when the written file cannot be removed
     */
    @Test
    void saveWithBlankOutputDirUsesWorkingDirectory() throws Exception {
        properties.setOutputDir("  ");

        Path written = service.save(multiStateDocument(), "blank-dir.pdf");
        try {
            assertThat(written.getParent()).isEqualTo(Path.of("").toAbsolutePath());
            assertThat(written).exists();
        } finally {
            Files.deleteIfExists(written);
        }
    }

    /**
     * Ensures export file names fall back to a fixed base and drop directories.
     */
    @Test
    void exportFileNameFallsBackForMissingSource() {
        assertThat(service.exportFileName(null)).matches("boundaries_extracted_\\d{8}_\\d{6}\\.json");
        assertThat(service.exportFileName("C:\\scans\\lagos.pdf")).startsWith("lagos_extracted_");
    }

    /**
     * Ensures missing documents and empty payloads are validation errors.
     */
    @Test
    void missingInputIsRejected() {
        assertThrows(JsonExportValidationException.class, () -> service.toJson(null));
        assertThrows(JsonExportValidationException.class, () -> service.fromJson(" "));
    }

    /**
     * Ensures truncated JSON surfaces as an infrastructure failure.
     */
    @Test
    void malformedJsonIsAnInfrastructureFailure() {
        assertThrows(JsonExportException.class, () -> service.fromJson("{\"states\": ["));
    }

    private static BoundaryDocument multiStateDocument() {
        BoundaryDocument document = new BoundaryDocument();
        document.addState(state("ABIA",
                lga("ABA NORTH", "01", ward("EZIAMA", "01"), ward("ARIARIA", "02")),
                lga("OHAFIA", "09", ward("AMAEKPU", "03"), ward("ABIRIBA", "01"))));
        document.addState(state("IMO",
                lga("OWERRI WEST", "17", ward("NEKEDE", "05"), ward("IHIAGWA", "04")),
                lga("ORLU", "12", ward("UMUTANZE", "02"), ward("OHAFOR", "01"))));
        return document;
    }

    private static List<String> outline(BoundaryDocument document) {
        return document.states().stream()
                .flatMap(state -> Stream.concat(
                        Stream.of(state.name()),
                        state.lgas().stream().flatMap(lga -> {
                            String lgaPath = state.name() + "/" + lga.name() + "/" + lga.code();
                            return Stream.concat(
                                    Stream.of(lgaPath),
                                    lga.wards().stream().map(w -> lgaPath + "/" + w.name() + "/" + w.code()));
                        })))
                .toList();
    }

    private static StateNode state(String name, LgaNode... lgas) {
        StateNode state = new StateNode(name);
        for (LgaNode lga : lgas) {
            state.addLga(lga);
        }
        return state;
    }

    private static LgaNode lga(String name, String code, WardNode... wards) {
        LgaNode lga = new LgaNode(name, code);
        for (WardNode ward : wards) {
            lga.addWard(ward);
        }
        return lga;
    }

    private static WardNode ward(String name, String code) {
        return new WardNode(name, code);
    }
}
