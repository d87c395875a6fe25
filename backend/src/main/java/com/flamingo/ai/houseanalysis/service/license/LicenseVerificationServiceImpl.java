package com.flamingo.ai.houseanalysis.service.license;

import com.flamingo.ai.houseanalysis.config.LicenseConfig;
import com.flamingo.ai.houseanalysis.exception.LicenseVerificationException;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;

/** Implementation of the LicenseVerificationService. */
@Service
@RequiredArgsConstructor
@Slf4j
public class LicenseVerificationServiceImpl implements LicenseVerificationService {

  static final String SINGLE_MATCH_MARKER = "총<b>1</b>건";

  private final AddressParser addressParser;
  private final AdministrativeCodeResolver administrativeCodeResolver;
  private final VworldClient vworldClient;
  private final LicenseConfig licenseConfig;
  private final MeterRegistry meterRegistry;

  @Override
  @Timed(value = "license.verify", description = "Time to verify a broker license")
  public boolean verify(String address, String officeName, String licenseNumber) {
    try {
      ParsedAddress parsed = addressParser.parse(address);
      ResolvedRegion region = administrativeCodeResolver.resolve(parsed);

      String html = vworldClient.searchBrokers(searchForm(region, officeName, licenseNumber));
      boolean verified = html.contains(SINGLE_MATCH_MARKER);

      meterRegistry.counter("license.verified", "result", String.valueOf(verified)).increment();
      log.info(
          "License check for office={}, license={} at {}: verified={}",
          officeName,
          licenseNumber,
          region.dongCode(),
          verified);
      return verified;
    } catch (LicenseVerificationException e) {
      log.error(
          "License verification failed - address: {}, office: {}, license: {}, error: {}",
          address,
          officeName,
          licenseNumber,
          e.getMessage());
      throw e;
    }
  }

  private MultiValueMap<String, String> searchForm(
      ResolvedRegion region, String officeName, String licenseNumber) {
    MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
    form.add("v_lawd_cd", region.dongCode());
    form.add("pageIndex", "1");
    form.add("recordCountPerPage", "10");
    form.add("v_sort", "");
    form.add("v_sort_order", "");
    form.add("GUJESI_YN", "Y");
    form.add("sggCd", "");
    form.add("raRegno", "");
    form.add("sysRegno", "");
    form.add("sidoCd", region.cityCode());
    form.add("sigunguCd", region.districtCode());
    form.add("dongCd", region.dongCode());
    form.add("svcCode", licenseConfig.getServiceCode());
    form.add("v_cmp_nm", officeName);
    form.add("v_ra_regno", licenseNumber);
    form.add("v_rdealer_nm", "");
    form.add("v_pos_gbn", "");
    return form;
  }
}
