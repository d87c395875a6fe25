package com.flamingo.ai.houseanalysis.service.license;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.houseanalysis.config.LicenseConfig;
import com.flamingo.ai.houseanalysis.exception.LicenseVerificationException;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;

/** HTTP client for the V-World legal-district code lists and broker registry search. */
@Component
@Slf4j
public class VworldClient {

  static final String CODE_LIST_PATH = "/dtld/comm/getBeopjeongDongList.do";
  static final String BROKER_SEARCH_PATH = "/dtld/broker/dtld_list_s001.do";

  private final WebClient webClient;
  private final ObjectMapper objectMapper;
  private final LicenseConfig licenseConfig;

  public VworldClient(
      @Qualifier("vworldWebClient") WebClient webClient,
      ObjectMapper objectMapper,
      LicenseConfig licenseConfig) {
    this.webClient = webClient;
    this.objectMapper = objectMapper;
    this.licenseConfig = licenseConfig;
  }

  /**
   * Lists the legal districts directly below a parent code.
   *
   * @param parentCode province or district code
   * @return child codes in portal order
   */
  public List<RegionCode> fetchChildRegions(String parentCode) {
    MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
    form.add("V_LAWD_CD", parentCode);
    form.add("GUJESI_YN", "Y");

    String json = post(CODE_LIST_PATH, form, MediaType.APPLICATION_JSON);
    try {
      JsonNode root = objectMapper.readTree(json == null ? "{}" : json);
      List<RegionCode> codes = new ArrayList<>();
      for (JsonNode entry : root.path("codeList")) {
        codes.add(new RegionCode(entry.path("cd").asText(), entry.path("nm").asText()));
      }
      log.debug("Fetched {} child region(s) for {}", codes.size(), parentCode);
      return codes;
    } catch (JsonProcessingException e) {
      throw new LicenseVerificationException(
          "Malformed region code list for " + parentCode, e);
    }
  }

  /**
   * Runs the broker registry search and returns the result page HTML.
   *
   * @param form search form fields
   * @return HTML of the result page, never null
   */
  public String searchBrokers(MultiValueMap<String, String> form) {
    String html = post(BROKER_SEARCH_PATH, form, MediaType.TEXT_HTML);
    return html == null ? "" : html;
  }

  private String post(String path, MultiValueMap<String, String> form, MediaType accept) {
    try {
      return webClient
          .post()
          .uri(path)
          .contentType(MediaType.APPLICATION_FORM_URLENCODED)
          .accept(accept, MediaType.ALL)
          .header(HttpHeaders.USER_AGENT, licenseConfig.getUserAgent())
          .header(HttpHeaders.ORIGIN, licenseConfig.getBaseUrl())
          .header(HttpHeaders.REFERER, licenseConfig.getBaseUrl() + BROKER_SEARCH_PATH)
          .body(BodyInserters.fromFormData(form))
          .retrieve()
          .bodyToMono(String.class)
          .timeout(licenseConfig.getTimeout())
          .block();
    } catch (RuntimeException e) {
      log.error("V-World call {} failed: {}", path, e.getMessage());
      throw new LicenseVerificationException("V-World request failed: " + e.getMessage(), e);
    }
  }
}
