package com.flamingo.ai.houseanalysis.domain.model;

import java.util.List;

/**
 * Six-field risk verdict for a residential lease. Every field is always populated.
 *
 * @param excessiveLoan mortgages or debts on the property are excessive
 * @param rightsRestriction seizures, provisional attachments or disposal bans are registered
 * @param trustProperty the property is held in trust
 * @param residentialUse the building ledger lists a residential use
 * @param taxDelinquency the owner has delinquent taxes
 * @param ownerVerification owner names match across all documents
 */
public record Verdict(
    boolean excessiveLoan,
    boolean rightsRestriction,
    boolean trustProperty,
    boolean residentialUse,
    boolean taxDelinquency,
    boolean ownerVerification) {

  public static final String EXCESSIVE_LOAN = "excessive_loan";
  public static final String RIGHTS_RESTRICTION = "rights_restriction";
  public static final String TRUST_PROPERTY = "trust_property";
  public static final String RESIDENTIAL_USE = "residential_use";
  public static final String TAX_DELINQUENCY = "tax_delinquency";
  public static final String OWNER_VERIFICATION = "owner_verification";

  /** Wire keys, in declaration order. */
  public static final List<String> KEYS =
      List.of(
          EXCESSIVE_LOAN,
          RIGHTS_RESTRICTION,
          TRUST_PROPERTY,
          RESIDENTIAL_USE,
          TAX_DELINQUENCY,
          OWNER_VERIFICATION);

  /**
   * Conservative default: risk-raising fields are false, while residential use and owner
   * verification (whose false value is the risk signal) are true.
   */
  public static final Verdict FALLBACK = new Verdict(false, false, false, true, false, true);
}
