package com.flamingo.ai.houseanalysis.api.rest;

import com.flamingo.ai.houseanalysis.api.dto.request.LicenseRequest;
import com.flamingo.ai.houseanalysis.api.dto.response.LicenseResponse;
import com.flamingo.ai.houseanalysis.service.license.LicenseVerificationService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for broker license verification. */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class LicenseController {

  private final LicenseVerificationService licenseVerificationService;

  /** Verifies a broker office against the public registry. */
  @PostMapping("/get_license")
  public ResponseEntity<LicenseResponse> getLicense(@Valid @RequestBody LicenseRequest request) {
    boolean verified =
        licenseVerificationService.verify(
            request.getAddress(), request.getOfficename(), request.getLicensenumber());
    return ResponseEntity.ok(new LicenseResponse(verified));
  }
}
