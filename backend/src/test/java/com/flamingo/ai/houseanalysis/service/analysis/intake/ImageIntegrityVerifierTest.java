package com.flamingo.ai.houseanalysis.service.analysis.intake;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.houseanalysis.support.TestDocuments;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ImageIntegrityVerifier Tests")
class ImageIntegrityVerifierTest {

  private final ImageIntegrityVerifier verifier = new ImageIntegrityVerifier();

  @Test
  @DisplayName("Should accept decodable PNG and JPEG images")
  void shouldAcceptDecodableImages() {
    assertThat(verifier.isReadableImage(TestDocuments.png())).isTrue();
    assertThat(verifier.isReadableImage(TestDocuments.jpeg())).isTrue();
  }

  @Test
  @DisplayName("Should accept WebP by signature when no decoder is installed")
  void shouldAcceptWebpBySignature() {
    assertThat(verifier.isReadableImage(TestDocuments.webpHeader())).isTrue();
  }

  @Test
  @DisplayName("Should reject text and empty payloads")
  void shouldRejectNonImages() {
    assertThat(verifier.isReadableImage("plain text".getBytes(StandardCharsets.UTF_8))).isFalse();
    assertThat(verifier.isReadableImage(new byte[0])).isFalse();
    assertThat(verifier.isReadableImage(null)).isFalse();
  }

  @Test
  @DisplayName("Should reject a truncated PNG")
  void shouldRejectTruncatedPng() {
    byte[] png = TestDocuments.png();
    byte[] truncated = Arrays.copyOf(png, 20);

    assertThat(verifier.isReadableImage(truncated)).isFalse();
  }
}
