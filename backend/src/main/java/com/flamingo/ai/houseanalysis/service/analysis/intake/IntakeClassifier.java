package com.flamingo.ai.houseanalysis.service.analysis.intake;

import com.flamingo.ai.houseanalysis.config.InferenceConfig;
import com.flamingo.ai.houseanalysis.domain.enums.DocumentKind;
import com.flamingo.ai.houseanalysis.domain.model.SourceDocument;
import com.flamingo.ai.houseanalysis.exception.DocumentTransformException;
import com.flamingo.ai.houseanalysis.exception.DocumentValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Tags each upload as an image or a PDF, rejecting anything else. */
@Component
@RequiredArgsConstructor
@Slf4j
public class IntakeClassifier {

  private final ImageIntegrityVerifier imageIntegrityVerifier;
  private final InferenceConfig inferenceConfig;

  /**
   * Classifies one upload.
   *
   * @param index position of the upload in the request
   * @param fileName original filename, may be null
   * @param bytes uploaded bytes
   * @return the classified document
   * @throws DocumentValidationException for a missing name, empty content, oversize content or an
   *     unsupported extension
   * @throws DocumentTransformException for an image that does not decode
   */
  public SourceDocument classify(int index, String fileName, byte[] bytes) {
    if (fileName == null || fileName.isBlank()) {
      throw new DocumentValidationException("A file without a filename was uploaded.");
    }

    DocumentKind kind =
        DocumentKind.fromFileName(fileName)
            .orElseThrow(
                () ->
                    new DocumentValidationException(
                        fileName,
                        "Unsupported file type: "
                            + fileName
                            + ". Only PDF or image files can be uploaded."));

    if (bytes == null || bytes.length == 0) {
      throw new DocumentValidationException(fileName, "File is empty: " + fileName);
    }
    long maxBytes = inferenceConfig.getIntake().getMaxFileSizeBytes();
    if (bytes.length > maxBytes) {
      throw new DocumentValidationException(
          fileName, "File too large: " + fileName + " (" + bytes.length + " bytes)");
    }

    if (kind == DocumentKind.IMAGE && !imageIntegrityVerifier.isReadableImage(bytes)) {
      throw new DocumentTransformException(
          fileName, "Image processing failed", "not a valid image file");
    }

    log.debug("Classified upload #{} {} as {}", index, fileName, kind);
    return new SourceDocument(index, fileName, kind, bytes);
  }
}
