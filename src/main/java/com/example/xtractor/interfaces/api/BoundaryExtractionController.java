package com.example.xtractor.interfaces.api;

import com.example.xtractor.application.exception.ApplicationException;
import com.example.xtractor.application.exception.JsonExportValidationException;
import com.example.xtractor.application.service.BoundaryExtractionService;
import com.example.xtractor.application.service.JsonExportService;
import com.example.xtractor.domain.exception.DomainException;
import com.example.xtractor.domain.model.ExtractionResult;
import com.example.xtractor.infrastructure.exception.InfrastructureException;
import jakarta.servlet.http.HttpSession;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Controller;
import org.springframework.ui.Model;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseBody;
import org.springframework.web.multipart.MultipartFile;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Map;

/**
 * Interfaces-layer MVC controller for boundary PDF uploads and JSON downloads.
 */
@Controller
public class BoundaryExtractionController {

    static final String SESSION_RESULT_KEY = "LATEST_EXTRACTION_RESULT";
    static final String EXPORT_FILE_HEADER = "X-Export-File";

    private final BoundaryExtractionService extractionService;
    private final JsonExportService jsonExportService;

    /**
     * @param extractionService service running the PDF through the extraction engine
     * @param jsonExportService service producing the states/lgas/wards JSON
     */
    public BoundaryExtractionController(BoundaryExtractionService extractionService,
                                        JsonExportService jsonExportService) {
        this.extractionService = extractionService;
        this.jsonExportService = jsonExportService;
    }

    /**
     * Renders the upload page with the last result of this session, if any.
     *
     * @param model   model exposed to the Thymeleaf view
     * @param session HTTP session storing the last extraction result
     * @return upload view name
     */
    @GetMapping("/")
    public String showUploadForm(Model model, HttpSession session) {
        model.addAttribute("result", session.getAttribute(SESSION_RESULT_KEY));
        model.addAttribute("error", null);
        return "upload";
    }

    /**
     * Handles the HTML form submission.
     *
     * @param file    uploaded PDF
     * @param model   model used for view rendering
     * @param session HTTP session for caching the result
     * @return upload view name populated with success or error data
     */
    @PostMapping("/extract")
    public String handleUpload(@RequestParam("file") MultipartFile file, Model model, HttpSession session) {
        try {
            ExtractionResult result = extractionService.extract(file);
            session.setAttribute(SESSION_RESULT_KEY, result);
            model.addAttribute("result", result);
            model.addAttribute("error", null);
        } catch (DomainException | ApplicationException ex) {
            model.addAttribute("result", null);
            model.addAttribute("error", ex.getMessage());
        } catch (InfrastructureException ex) {
            model.addAttribute("result", null);
            model.addAttribute("error", "We couldn't read that PDF. Please try another file.");
        }
        return "upload";
    }

    /**
     * JSON variant of the upload form.
     *
     * @param file     uploaded PDF
     * @param saveJson also write the document to the export directory
     * @param session  HTTP session for caching the result
     * @return extraction result; the written file is reported in the {@code X-Export-File} header
     */
    @PostMapping(value = "/api/extract", produces = MediaType.APPLICATION_JSON_VALUE)
    @ResponseBody
    public ResponseEntity<ExtractionResult> handleUploadApi(@RequestParam("file") MultipartFile file,
                                                            @RequestParam(value = "saveJson", defaultValue = "false") boolean saveJson,
                                                            HttpSession session) {
        ExtractionResult result = extractionService.extract(file);
        session.setAttribute(SESSION_RESULT_KEY, result);
        ResponseEntity.BodyBuilder response = ResponseEntity.ok();
        if (saveJson) {
            Path written = jsonExportService.save(result.document(), result.fileName());
            response.header(EXPORT_FILE_HEADER, written.getFileName().toString());
        }
        return response.body(result);
    }

    /**
     * Streams the document of the last extraction in this session as a JSON download.
     *
     * @param session HTTP session storing the cached extraction result
     * @return JSON document as an attachment
     */
    @PostMapping("/export")
    public ResponseEntity<byte[]> exportJson(HttpSession session) {
        ExtractionResult cached = (ExtractionResult) session.getAttribute(SESSION_RESULT_KEY);
        if (cached == null) {
            throw new JsonExportValidationException("No extraction result available for export.");
        }
        String json = jsonExportService.toJson(cached.document());
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"boundaries.json\"")
                .contentType(MediaType.APPLICATION_JSON)
                .body(json.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Health check for load balancers and deployment scripts.
     *
     * @return fixed {@code healthy} status
     */
    @GetMapping(value = "/api/health", produces = MediaType.APPLICATION_JSON_VALUE)
    @ResponseBody
    public Map<String, String> health() {
        return Map.of("status", "healthy");
    }
}
