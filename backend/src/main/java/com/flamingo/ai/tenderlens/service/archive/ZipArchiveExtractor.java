package com.flamingo.ai.tenderlens.service.archive;

import com.flamingo.ai.tenderlens.config.PipelineConfig;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Enumeration;
import java.util.zip.ZipEntry;
import java.util.zip.ZipException;
import java.util.zip.ZipFile;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Zip support via {@link ZipFile}.
 *
 * <p>Entry names are read as UTF-8 first; archives produced by Windows tools without the UTF-8 flag
 * are re-read with the configured fallback charset. Entries resolving outside the destination are
 * skipped.
 */
@Component
@Order(1)
@RequiredArgsConstructor
@Slf4j
public class ZipArchiveExtractor implements ArchiveExtractor {

  private final PipelineConfig pipelineConfig;

  @Override
  public boolean supports(String extension) {
    return "zip".equals(extension);
  }

  @Override
  public void extractAll(Path archive, Path destination) throws IOException {
    try {
      extractWith(archive, destination, StandardCharsets.UTF_8);
    } catch (ZipException | IllegalArgumentException e) {
      Charset fallback = Charset.forName(pipelineConfig.getArchive().getFallbackCharset());
      log.debug(
          "Zip {} is not readable as UTF-8 ({}), retrying with {}",
          archive.getFileName(),
          e.getMessage(),
          fallback);
      extractWith(archive, destination, fallback);
    }
  }

  private void extractWith(Path archive, Path destination, Charset charset) throws IOException {
    Path root = destination.toAbsolutePath().normalize();
    try (ZipFile zip = new ZipFile(archive.toFile(), charset)) {
      Enumeration<? extends ZipEntry> entries = zip.entries();
      while (entries.hasMoreElements()) {
        ZipEntry entry = entries.nextElement();
        Path target = root.resolve(entry.getName()).normalize();
        if (!target.startsWith(root)) {
          log.warn("Skipping zip entry outside destination: {}", entry.getName());
          continue;
        }
        if (entry.isDirectory()) {
          Files.createDirectories(target);
          continue;
        }
        Files.createDirectories(target.getParent());
        try (InputStream in = zip.getInputStream(entry)) {
          Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
        }
      }
    }
  }
}
