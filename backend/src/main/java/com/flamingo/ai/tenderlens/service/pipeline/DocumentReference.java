package com.flamingo.ai.tenderlens.service.pipeline;

import java.nio.file.Path;

/**
 * A file collected for one run.
 *
 * @param displayName name reported in provenance and rejections
 * @param path file on disk
 * @param fromArchive whether the file was unpacked from an archive of the batch
 */
public record DocumentReference(String displayName, Path path, boolean fromArchive) {

  static DocumentReference topLevel(Path path) {
    return new DocumentReference(path.getFileName().toString(), path, false);
  }

  static DocumentReference archiveMember(Path path) {
    return new DocumentReference(path.getFileName().toString(), path, true);
  }
}
