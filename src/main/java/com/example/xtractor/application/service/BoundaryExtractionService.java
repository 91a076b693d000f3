package com.example.xtractor.application.service;

import com.example.xtractor.application.extraction.ExtractionOutcome;
import com.example.xtractor.application.extraction.HierarchyExtractionEngine;
import com.example.xtractor.domain.exception.PdfFileRequiredException;
import com.example.xtractor.domain.exception.PdfNotFoundException;
import com.example.xtractor.domain.exception.PdfPathRequiredException;
import com.example.xtractor.domain.exception.UnsupportedPdfFormatException;
import com.example.xtractor.domain.model.ExtractionResult;
import com.example.xtractor.domain.model.PageContent;
import com.example.xtractor.infrastructure.exception.PdfProcessingException;
import com.example.xtractor.infrastructure.pdf.PdfBoxPageReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Application-layer service that turns a boundary PDF into a State / LGA / Ward document.
 * It validates the input, lets the PDFBox reader materialize the pages and hands them to the engine.
 */
@Service
public class BoundaryExtractionService {

    private static final Logger log = LoggerFactory.getLogger(BoundaryExtractionService.class);

    private final PdfBoxPageReader pageReader;
    private final HierarchyExtractionEngine engine;

    /**
     * @param pageReader infrastructure reader producing page tables and text
     * @param engine     hierarchy extraction engine
     */
    public BoundaryExtractionService(PdfBoxPageReader pageReader, HierarchyExtractionEngine engine) {
        this.pageReader = pageReader;
        this.engine = engine;
    }

    /**
     * Extracts the hierarchy from an uploaded PDF.
     *
     * @param file uploaded PDF file
     * @return extraction result with document and statistics
     * @throws PdfFileRequiredException      when the file is null or empty
     * @throws UnsupportedPdfFormatException when the MIME type/name does not look like a PDF
     * @throws PdfProcessingException        when PDFBox cannot read the bytes
     */
    public ExtractionResult extract(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new PdfFileRequiredException();
        }
        if (!looksLikePdf(file)) {
            throw new UnsupportedPdfFormatException(file.getOriginalFilename());
        }
        String fileName = resolveFileName(file);
        try {
            return extractInternal(file.getBytes(), fileName);
        } catch (IOException e) {
            throw new PdfProcessingException("Unable to process the uploaded PDF file.", e);
        }
    }

    /**
     * Extracts the hierarchy from a PDF on disk.
     *
     * @param pdfPath path pointing to a PDF file
     * @return extraction result with document and statistics
     * @throws PdfPathRequiredException when {@code pdfPath} is null
     * @throws PdfNotFoundException     when the path does not exist
     * @throws PdfProcessingException   when the file cannot be read
     */
    public ExtractionResult extract(Path pdfPath) {
        if (pdfPath == null) {
            throw new PdfPathRequiredException();
        }
        if (!Files.exists(pdfPath)) {
            throw new PdfNotFoundException(pdfPath.toAbsolutePath().toString());
        }
        try {
            byte[] pdfBytes = Files.readAllBytes(pdfPath);
            String fileName = pdfPath.getFileName() != null ? pdfPath.getFileName().toString() : "boundaries.pdf";
            return extractInternal(pdfBytes, fileName);
        } catch (IOException e) {
            throw new PdfProcessingException("Unable to process the PDF at " + pdfPath, e);
        }
    }

    private ExtractionResult extractInternal(byte[] bytes, String fileName) throws IOException {
        log.info("Starting extraction from {}", fileName);
        List<PageContent> pages = pageReader.read(bytes);
        ExtractionOutcome outcome = engine.extract(pages);
        log.info("Extraction from {} finished: {}", fileName, outcome.statistics());
        return new ExtractionResult(fileName, pages.size(), outcome.document(), outcome.statistics());
    }

    /**
     * @param file uploaded file
     * @return {@code true} when the content type or suffix indicates a PDF
     */
    private boolean looksLikePdf(MultipartFile file) {
        String contentType = file.getContentType();
        if (contentType != null && contentType.equalsIgnoreCase("application/pdf")) {
            return true;
        }
        String fileName = file.getOriginalFilename();
        return fileName != null && fileName.toLowerCase(Locale.ROOT).endsWith(".pdf");
    }

    private String resolveFileName(MultipartFile file) {
        String fileName = file.getOriginalFilename();
        if (fileName == null || fileName.isBlank()) {
            return "uploaded.pdf";
        }
        return fileName;
    }
}
