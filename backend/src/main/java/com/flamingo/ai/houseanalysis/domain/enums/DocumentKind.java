package com.flamingo.ai.houseanalysis.domain.enums;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/** Kind of an uploaded document, decided by its filename extension. */
public enum DocumentKind {
  IMAGE,
  PDF;

  private static final Set<String> IMAGE_EXTENSIONS =
      Set.of("jpg", "jpeg", "png", "bmp", "webp", "gif");

  /**
   * Classifies a filename by extension, case-insensitively.
   *
   * @param fileName uploaded filename
   * @return the kind, or empty when the extension is not supported
   */
  public static Optional<DocumentKind> fromFileName(String fileName) {
    String extension = extensionOf(fileName);
    if ("pdf".equals(extension)) {
      return Optional.of(PDF);
    }
    if (IMAGE_EXTENSIONS.contains(extension)) {
      return Optional.of(IMAGE);
    }
    return Optional.empty();
  }

  /** Lower-case extension without the dot, or an empty string. */
  public static String extensionOf(String fileName) {
    if (fileName == null) {
      return "";
    }
    int dot = fileName.lastIndexOf('.');
    if (dot < 0 || dot == fileName.length() - 1) {
      return "";
    }
    return fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
  }
}
