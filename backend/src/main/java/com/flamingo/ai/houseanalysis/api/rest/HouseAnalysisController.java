package com.flamingo.ai.houseanalysis.api.rest;

import com.flamingo.ai.houseanalysis.api.dto.response.AnalysisResponse;
import com.flamingo.ai.houseanalysis.domain.model.Verdict;
import com.flamingo.ai.houseanalysis.service.analysis.HouseAnalysisService;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/** REST controller for lease risk analysis of uploaded property documents. */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class HouseAnalysisController {

  private final HouseAnalysisService houseAnalysisService;

  /**
   * Analyzes tax certificates, registry extracts and building ledgers for lease risks.
   *
   * @param files PDF or image uploads, in the order they should be shown to the model
   * @return the six-field verdict
   */
  @PostMapping(value = "/analyze_house", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  public ResponseEntity<AnalysisResponse> analyzeHouse(
      @RequestParam(value = "files", required = false) List<MultipartFile> files) {
    Verdict verdict = houseAnalysisService.analyze(files);
    return ResponseEntity.ok(AnalysisResponse.fromVerdict(verdict));
  }
}
