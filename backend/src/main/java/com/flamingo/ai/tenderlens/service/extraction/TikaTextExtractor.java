package com.flamingo.ai.tenderlens.service.extraction;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.apache.tika.Tika;
import org.apache.tika.exception.TikaException;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * {@link TextExtractor} for office and text formats using Apache Tika's plain-text extraction.
 *
 * <p>Covers DOCX and legacy DOC, RTF (markup is stripped by Tika), ODT and plain text.
 */
@Component
@Order(100)
@Slf4j
public class TikaTextExtractor implements TextExtractor {

  private static final Set<String> SUPPORTED = Set.of("doc", "docx", "rtf", "odt", "txt");

  private final Tika tika;

  public TikaTextExtractor() {
    this.tika = new Tika();
    this.tika.setMaxStringLength(-1);
  }

  @Override
  public boolean supports(String extension) {
    return SUPPORTED.contains(extension);
  }

  @Override
  public String extract(Path file) throws IOException {
    try {
      return tika.parseToString(file);
    } catch (TikaException e) {
      throw new IOException("Tika failed to parse " + file.getFileName(), e);
    }
  }
}
