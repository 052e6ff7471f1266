package com.flamingo.ai.tenderlens.service.extraction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("PdfBoxTextExtractor Tests")
class PdfBoxTextExtractorTest {

  @TempDir Path tempDir;

  private final PdfBoxTextExtractor extractor = new PdfBoxTextExtractor();

  @Test
  @DisplayName("Should read the text layer of a PDF")
  void shouldReadTextLayer() throws Exception {
    Path pdf = writePdf("Technical specification: paper A4");

    assertThat(extractor.extract(pdf)).contains("Technical specification: paper A4");
  }

  @Test
  @DisplayName("Should return blank text for a PDF without text")
  void shouldReturnBlankForEmptyPage() throws Exception {
    Path pdf = tempDir.resolve("scan.pdf");
    try (PDDocument document = new PDDocument()) {
      document.addPage(new PDPage());
      document.save(pdf.toFile());
    }

    assertThat(extractor.extract(pdf)).isBlank();
  }

  @Test
  @DisplayName("Should fail on a file that is not a PDF")
  void shouldFailOnCorruptFile() throws Exception {
    Path broken = tempDir.resolve("broken.pdf");
    Files.writeString(broken, "not a pdf");

    assertThatThrownBy(() -> extractor.extract(broken)).isInstanceOf(IOException.class);
  }

  private Path writePdf(String line) throws IOException {
    Path pdf = tempDir.resolve("spec.pdf");
    try (PDDocument document = new PDDocument()) {
      PDPage page = new PDPage();
      document.addPage(page);
      try (PDPageContentStream content = new PDPageContentStream(document, page)) {
        content.beginText();
        content.setFont(new PDType1Font(Standard14Fonts.FontName.HELVETICA), 12);
        content.newLineAtOffset(72, 700);
        content.showText(line);
        content.endText();
      }
      document.save(pdf.toFile());
    }
    return pdf;
  }
}
