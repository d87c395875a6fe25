package com.flamingo.ai.houseanalysis.api;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.houseanalysis.api.dto.response.AnalysisResponse;
import com.flamingo.ai.houseanalysis.api.rest.HealthController;
import com.flamingo.ai.houseanalysis.api.rest.HouseAnalysisController;
import com.flamingo.ai.houseanalysis.api.rest.LicenseController;
import com.flamingo.ai.houseanalysis.domain.model.Verdict;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;

/**
 * Contract tests for the public endpoints and the verdict wire format.
 *
 * <ul>
 *   <li>POST /api/analyze_house - Analyze uploaded documents
 *   <li>POST /api/get_license - Verify a broker license
 *   <li>GET / - Service banner
 *   <li>GET /health - Health check
 * </ul>
 *
 * <p>If these tests fail, the controllers have drifted from the published API.
 */
class ApiContractTest {

  @Nested
  @DisplayName("HouseAnalysisController API contract")
  class HouseAnalysisControllerContract {

    @Test
    @DisplayName("should be mapped to POST /api/analyze_house")
    void shouldBeMappedToAnalyzeHouse() throws Exception {
      RequestMapping mapping = HouseAnalysisController.class.getAnnotation(RequestMapping.class);
      assertThat(mapping).isNotNull();
      assertThat(mapping.value()).containsExactly("/api");

      PostMapping post =
          HouseAnalysisController.class
              .getMethod("analyzeHouse", List.class)
              .getAnnotation(PostMapping.class);
      assertThat(post.value()).containsExactly("/analyze_house");
    }
  }

  @Nested
  @DisplayName("LicenseController API contract")
  class LicenseControllerContract {

    @Test
    @DisplayName("should be mapped to POST /api/get_license")
    void shouldBeMappedToGetLicense() {
      RequestMapping mapping = LicenseController.class.getAnnotation(RequestMapping.class);
      assertThat(mapping).isNotNull();
      assertThat(mapping.value()).containsExactly("/api");
    }
  }

  @Nested
  @DisplayName("HealthController API contract")
  class HealthControllerContract {

    @Test
    @DisplayName("should serve / and /health")
    void shouldServeRootAndHealth() throws Exception {
      assertThat(
              HealthController.class.getMethod("root").getAnnotation(GetMapping.class).value())
          .containsExactly("/");
      assertThat(
              HealthController.class.getMethod("health").getAnnotation(GetMapping.class).value())
          .containsExactly("/health");
    }
  }

  @Nested
  @DisplayName("Verdict wire format")
  class VerdictWireFormat {

    @Test
    @DisplayName("should serialize exactly the six snake_case keys in order")
    void shouldSerializeSixKeys() throws Exception {
      String json =
          new ObjectMapper()
              .writeValueAsString(AnalysisResponse.fromVerdict(Verdict.FALLBACK));

      List<String> fields = new ArrayList<>();
      new ObjectMapper().readTree(json).fieldNames().forEachRemaining(fields::add);
      assertThat(fields).containsExactlyElementsOf(Verdict.KEYS);
    }
  }
}
