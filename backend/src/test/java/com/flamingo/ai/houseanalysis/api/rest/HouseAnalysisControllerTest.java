package com.flamingo.ai.houseanalysis.api.rest;

import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.flamingo.ai.houseanalysis.domain.model.Verdict;
import com.flamingo.ai.houseanalysis.exception.DocumentTransformException;
import com.flamingo.ai.houseanalysis.exception.DocumentValidationException;
import com.flamingo.ai.houseanalysis.exception.GlobalExceptionHandler;
import com.flamingo.ai.houseanalysis.exception.UpstreamServiceException;
import com.flamingo.ai.houseanalysis.service.analysis.HouseAnalysisService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
@DisplayName("HouseAnalysisController Tests")
class HouseAnalysisControllerTest {

  @Mock private HouseAnalysisService houseAnalysisService;

  private MockMvc mockMvc;

  @BeforeEach
  void setUp() {
    mockMvc =
        MockMvcBuilders.standaloneSetup(
                new HouseAnalysisController(houseAnalysisService), new HealthController())
            .setControllerAdvice(new GlobalExceptionHandler(new SimpleMeterRegistry()))
            .build();
  }

  @Test
  @DisplayName("Should return the verdict with snake_case keys")
  void shouldReturnVerdict() throws Exception {
    when(houseAnalysisService.analyze(anyList()))
        .thenReturn(new Verdict(true, false, true, false, true, false));

    mockMvc
        .perform(multipart("/api/analyze_house").file(file("tax.png")))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.excessive_loan").value(true))
        .andExpect(jsonPath("$.rights_restriction").value(false))
        .andExpect(jsonPath("$.trust_property").value(true))
        .andExpect(jsonPath("$.residential_use").value(false))
        .andExpect(jsonPath("$.tax_delinquency").value(true))
        .andExpect(jsonPath("$.owner_verification").value(false));
  }

  @Test
  @DisplayName("Should map a request without files to 400")
  void shouldRejectMissingFiles() throws Exception {
    when(houseAnalysisService.analyze(isNull()))
        .thenThrow(new DocumentValidationException("At least one file is required."));

    mockMvc
        .perform(multipart("/api/analyze_house"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("VALIDATION_001"))
        .andExpect(jsonPath("$.message").value("At least one file is required."))
        .andExpect(jsonPath("$.path").value("/api/analyze_house"));
  }

  @Test
  @DisplayName("Should map transform errors to 400 naming the file")
  void shouldMapTransformError() throws Exception {
    when(houseAnalysisService.analyze(anyList()))
        .thenThrow(
            new DocumentTransformException(
                "broken.pdf", "PDF image conversion failed", "Header doesn't contain versioninfo"));

    mockMvc
        .perform(multipart("/api/analyze_house").file(file("broken.pdf")))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("DOCUMENT_002"))
        .andExpect(jsonPath("$.fileName").value("broken.pdf"));
  }

  @Test
  @DisplayName("Should map asset registration failures to 502")
  void shouldMapUpstreamError() throws Exception {
    when(houseAnalysisService.analyze(anyList()))
        .thenThrow(
            new UpstreamServiceException(
                "tax.png", "status 500", new RuntimeException("status 500")));

    mockMvc
        .perform(multipart("/api/analyze_house").file(file("tax.png")))
        .andExpect(status().isBadGateway())
        .andExpect(jsonPath("$.code").value("UPSTREAM_001"))
        .andExpect(
            jsonPath("$.message").value("File upload to the analysis service failed (tax.png)"));
  }

  @Test
  @DisplayName("Should map unexpected errors to 500")
  void shouldMapUnexpectedError() throws Exception {
    when(houseAnalysisService.analyze(anyList())).thenThrow(new IllegalStateException("boom"));

    mockMvc
        .perform(multipart("/api/analyze_house").file(file("tax.png")))
        .andExpect(status().isInternalServerError())
        .andExpect(jsonPath("$.code").value("INTERNAL_001"));
  }

  @Test
  @DisplayName("Should serve the banner and health endpoints")
  void shouldServeBannerAndHealth() throws Exception {
    mockMvc
        .perform(get("/"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.message").value("House Analysis API"));
    mockMvc
        .perform(get("/health"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("UP"));
  }

  private MockMultipartFile file(String name) {
    return new MockMultipartFile("files", name, "application/octet-stream", new byte[] {1, 2});
  }
}
