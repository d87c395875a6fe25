package com.flamingo.ai.houseanalysis.api.rest;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.flamingo.ai.houseanalysis.exception.GlobalExceptionHandler;
import com.flamingo.ai.houseanalysis.exception.LicenseVerificationException;
import com.flamingo.ai.houseanalysis.service.license.LicenseVerificationService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
@DisplayName("LicenseController Tests")
class LicenseControllerTest {

  private static final String BODY =
      "{\"address\":\"서울특별시 강남구 역삼동 1\",\"officename\":\"행복공인중개사\","
          + "\"licensenumber\":\"11680-2020-00001\"}";

  @Mock private LicenseVerificationService licenseVerificationService;

  private MockMvc mockMvc;

  @BeforeEach
  void setUp() {
    mockMvc =
        MockMvcBuilders.standaloneSetup(new LicenseController(licenseVerificationService))
            .setControllerAdvice(new GlobalExceptionHandler(new SimpleMeterRegistry()))
            .build();
  }

  @Test
  @DisplayName("Should return the verification result")
  void shouldReturnVerified() throws Exception {
    when(licenseVerificationService.verify(
            "서울특별시 강남구 역삼동 1", "행복공인중개사", "11680-2020-00001"))
        .thenReturn(true);

    mockMvc
        .perform(post("/api/get_license").contentType(MediaType.APPLICATION_JSON).content(BODY))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.verified").value(true));
  }

  @Test
  @DisplayName("Should reject a blank field before calling the registry")
  void shouldRejectBlankField() throws Exception {
    mockMvc
        .perform(
            post("/api/get_license")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"address\":\"\",\"officename\":\"x\",\"licensenumber\":\"y\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("VALIDATION_001"));
    verifyNoInteractions(licenseVerificationService);
  }

  @Test
  @DisplayName("Should map verification failures to 400")
  void shouldMapVerificationFailure() throws Exception {
    when(licenseVerificationService.verify(anyString(), anyString(), anyString()))
        .thenThrow(new LicenseVerificationException("District not found: Gangnam-gu"));

    mockMvc
        .perform(post("/api/get_license").contentType(MediaType.APPLICATION_JSON).content(BODY))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("LICENSE_001"))
        .andExpect(
            jsonPath("$.message")
                .value("License verification failed: District not found: Gangnam-gu"));
  }
}
