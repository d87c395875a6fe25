package com.flamingo.ai.houseanalysis.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for verifying a broker office license. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LicenseRequest {

  @NotBlank(message = "Address is required")
  private String address;

  @NotBlank(message = "Office name is required")
  private String officename;

  @NotBlank(message = "License number is required")
  private String licensenumber;
}
