package com.flamingo.ai.houseanalysis.api.dto.response;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a license verification. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LicenseResponse {

  private boolean verified;
}
