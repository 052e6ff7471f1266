package com.flamingo.ai.tenderlens.service.dedup;

import com.flamingo.ai.tenderlens.config.PipelineConfig;
import java.io.IOException;
import java.nio.file.Path;
import lombok.RequiredArgsConstructor;
import org.apache.commons.codec.digest.DigestUtils;
import org.springframework.stereotype.Component;

/** Hex digest of a file's raw bytes, used as the primary dedup key. */
@Component
@RequiredArgsConstructor
public class ContentFingerprinter {

  private final PipelineConfig pipelineConfig;

  public String fingerprint(Path file) throws IOException {
    return new DigestUtils(pipelineConfig.getDedup().getDigestAlgorithm())
        .digestAsHex(file.toFile());
  }
}
