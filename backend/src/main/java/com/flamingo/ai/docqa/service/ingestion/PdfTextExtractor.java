package com.flamingo.ai.docqa.service.ingestion;

import com.flamingo.ai.docqa.exception.TextExtractionException;
import java.io.IOException;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Service;

/** Extracts plain text from PDF bytes with Apache PDFBox 3.x. */
@Service
@Slf4j
public class PdfTextExtractor {

  /**
   * Extracts the text of every page in reading order.
   *
   * @param fileName name used in log and error messages
   * @param bytes raw PDF content
   * @return extracted text, possibly blank for image-only PDFs
   * @throws TextExtractionException if the bytes are not a readable PDF
   */
  public String extract(String fileName, byte[] bytes) {
    try (PDDocument pdfDoc = Loader.loadPDF(bytes)) {
      PDFTextStripper stripper = new PDFTextStripper();
      stripper.setSortByPosition(true);
      String text = stripper.getText(pdfDoc);
      log.debug(
          "Extracted {} chars from {} pages of {}",
          text.length(),
          pdfDoc.getNumberOfPages(),
          fileName);
      return text;
    } catch (IOException e) {
      log.error("PDFBox parsing failed for {}: {}", fileName, e.getMessage());
      throw new TextExtractionException(fileName, "Failed to parse PDF: " + e.getMessage(), e);
    }
  }
}
