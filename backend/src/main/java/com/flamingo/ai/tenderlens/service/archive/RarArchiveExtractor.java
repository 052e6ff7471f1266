package com.flamingo.ai.tenderlens.service.archive;

import com.github.junrar.Junrar;
import com.github.junrar.exception.RarException;
import java.io.IOException;
import java.nio.file.Path;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.util.ClassUtils;

/**
 * RAR support backed by junrar, which is an optional dependency.
 *
 * <p>When junrar is missing from the classpath the extractor reports itself unavailable and RAR
 * archives are skipped instead of failing the run. The junrar call is isolated in {@link
 * JunrarBridge} so this class loads without the library.
 */
@Component
@Order(2)
@Slf4j
public class RarArchiveExtractor implements ArchiveExtractor {

  private static final String JUNRAR_CLASS = "com.github.junrar.Junrar";

  private final boolean available;

  public RarArchiveExtractor() {
    this(ClassUtils.isPresent(JUNRAR_CLASS, RarArchiveExtractor.class.getClassLoader()));
  }

  RarArchiveExtractor(boolean available) {
    this.available = available;
    if (!available) {
      log.warn("junrar is not on the classpath; RAR archives will be skipped");
    }
  }

  @Override
  public boolean supports(String extension) {
    return "rar".equals(extension);
  }

  @Override
  public boolean isAvailable() {
    return available;
  }

  @Override
  public void extractAll(Path archive, Path destination) throws IOException {
    if (!available) {
      throw new IOException("RAR support is not available");
    }
    JunrarBridge.extract(archive, destination);
  }

  private static final class JunrarBridge {

    private JunrarBridge() {}

    static void extract(Path archive, Path destination) throws IOException {
      try {
        Junrar.extract(archive.toFile(), destination.toFile());
      } catch (RarException e) {
        throw new IOException("Failed to extract RAR " + archive.getFileName(), e);
      }
    }
  }
}
