package com.flamingo.ai.tenderlens.service.extraction;

import java.io.IOException;
import java.nio.file.Path;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * {@link TextExtractor} for PDF documents using Apache PDFBox 3.x.
 *
 * <p>Only the text layer is read. Scanned PDFs without one yield blank text and are skipped
 * upstream.
 */
@Component
@Order(1)
@Slf4j
public class PdfBoxTextExtractor implements TextExtractor {

  @Override
  public boolean supports(String extension) {
    return "pdf".equals(extension);
  }

  @Override
  public String extract(Path file) throws IOException {
    try (PDDocument pdf = Loader.loadPDF(file.toFile())) {
      PDFTextStripper stripper = new PDFTextStripper();
      String text = stripper.getText(pdf);
      log.debug("PDFBox extracted {} chars from {} pages", text.length(), pdf.getNumberOfPages());
      return text;
    }
  }
}
