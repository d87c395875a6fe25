package com.flamingo.ai.houseanalysis.api.dto.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.flamingo.ai.houseanalysis.domain.model.Verdict;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a lease risk analysis. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({
  Verdict.EXCESSIVE_LOAN,
  Verdict.RIGHTS_RESTRICTION,
  Verdict.TRUST_PROPERTY,
  Verdict.RESIDENTIAL_USE,
  Verdict.TAX_DELINQUENCY,
  Verdict.OWNER_VERIFICATION
})
public class AnalysisResponse {

  @JsonProperty(Verdict.EXCESSIVE_LOAN)
  private boolean excessiveLoan;

  @JsonProperty(Verdict.RIGHTS_RESTRICTION)
  private boolean rightsRestriction;

  @JsonProperty(Verdict.TRUST_PROPERTY)
  private boolean trustProperty;

  @JsonProperty(Verdict.RESIDENTIAL_USE)
  private boolean residentialUse;

  @JsonProperty(Verdict.TAX_DELINQUENCY)
  private boolean taxDelinquency;

  @JsonProperty(Verdict.OWNER_VERIFICATION)
  private boolean ownerVerification;

  /** Creates an AnalysisResponse from a verdict. */
  public static AnalysisResponse fromVerdict(Verdict verdict) {
    return AnalysisResponse.builder()
        .excessiveLoan(verdict.excessiveLoan())
        .rightsRestriction(verdict.rightsRestriction())
        .trustProperty(verdict.trustProperty())
        .residentialUse(verdict.residentialUse())
        .taxDelinquency(verdict.taxDelinquency())
        .ownerVerification(verdict.ownerVerification())
        .build();
  }
}
