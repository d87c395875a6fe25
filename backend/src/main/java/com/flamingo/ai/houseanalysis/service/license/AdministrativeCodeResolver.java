package com.flamingo.ai.houseanalysis.service.license;

import com.flamingo.ai.houseanalysis.exception.LicenseVerificationException;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Resolves a parsed address to province, district and dong codes via the V-World code lists. */
@Service
@RequiredArgsConstructor
@Slf4j
public class AdministrativeCodeResolver {

  private final VworldClient vworldClient;

  public ResolvedRegion resolve(ParsedAddress address) {
    String districtCode =
        findCode(vworldClient.fetchChildRegions(address.cityCode()), address.districtName())
            .orElseThrow(
                () ->
                    new LicenseVerificationException(
                        "District not found: " + address.districtName()));

    String dongCode =
        findCode(vworldClient.fetchChildRegions(districtCode), address.dongName())
            .orElseThrow(
                () -> new LicenseVerificationException("Dong not found: " + address.dongName()));

    log.debug(
        "Resolved {} {} {} to {}/{}/{}",
        address.cityName(),
        address.districtName(),
        address.dongName(),
        address.cityCode(),
        districtCode,
        dongCode);
    return new ResolvedRegion(address.cityCode(), districtCode, dongCode);
  }

  private Optional<String> findCode(List<RegionCode> codes, String token) {
    if (token == null) {
      return Optional.empty();
    }
    return codes.stream()
        .filter(code -> code.name() != null && code.name().contains(token))
        .map(RegionCode::code)
        .findFirst();
  }
}
