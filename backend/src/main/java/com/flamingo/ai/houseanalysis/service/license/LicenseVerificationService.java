package com.flamingo.ai.houseanalysis.service.license;

/** Verifies that a real estate broker office is registered under a license number. */
public interface LicenseVerificationService {

  /**
   * Checks the broker registry for exactly one office matching the name and license number at the
   * address's administrative district.
   *
   * @param address free-text office address
   * @param officeName registered office name
   * @param licenseNumber broker registration number
   * @return true when exactly one registration matches
   */
  boolean verify(String address, String officeName, String licenseNumber);
}
