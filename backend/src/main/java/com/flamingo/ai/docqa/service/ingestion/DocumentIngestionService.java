package com.flamingo.ai.docqa.service.ingestion;

import com.flamingo.ai.docqa.config.RagConfig;
import com.flamingo.ai.docqa.exception.DocumentValidationException;
import com.flamingo.ai.docqa.exception.TextExtractionException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

/** Validates uploaded files and turns them into plain text for the pipeline. */
@Service
@RequiredArgsConstructor
@Slf4j
public class DocumentIngestionService {

  static final String PDF_MIME_TYPE = "application/pdf";

  private final PdfTextExtractor pdfTextExtractor;
  private final RagConfig ragConfig;

  /**
   * Validates and extracts an uploaded PDF.
   *
   * @param file the multipart upload
   * @return filename, size and extracted text
   * @throws DocumentValidationException if the file is not an acceptable PDF
   * @throws TextExtractionException if no text can be extracted
   */
  public ExtractedUpload ingest(MultipartFile file) {
    validateFile(file);
    String fileName = file.getOriginalFilename();

    byte[] bytes;
    try {
      bytes = file.getBytes();
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read upload " + fileName, e);
    }

    String text = pdfTextExtractor.extract(fileName, bytes);
    if (text == null || text.isBlank()) {
      throw new TextExtractionException(fileName, "No text could be extracted from the PDF");
    }
    log.info("Ingested {} ({} bytes, {} chars of text)", fileName, bytes.length, text.length());
    return new ExtractedUpload(fileName, bytes.length, text);
  }

  private void validateFile(MultipartFile file) {
    if (file == null || file.isEmpty()) {
      throw new DocumentValidationException("File is empty", "Please upload a valid PDF file");
    }

    String contentType = file.getContentType();
    if (!PDF_MIME_TYPE.equals(contentType)) {
      throw new DocumentValidationException(
          "Unsupported file type: " + contentType,
          "Invalid file type: " + contentType + ". Only PDF files are allowed.");
    }

    long maxSize = ragConfig.getUpload().getMaxFileSizeBytes();
    if (file.getSize() > maxSize) {
      throw new DocumentValidationException(
          "File too large: " + file.getSize(),
          String.format("File size exceeds maximum limit of %dMB", maxSize / (1024 * 1024)));
    }

    String fileName = file.getOriginalFilename();
    if (fileName == null || fileName.isBlank()) {
      throw new DocumentValidationException("Missing filename", "No filename provided");
    }
    if (!fileName.toLowerCase(Locale.ROOT).endsWith(".pdf")) {
      throw new DocumentValidationException(
          "Unexpected extension: " + fileName, "File must have .pdf extension");
    }
  }
}
