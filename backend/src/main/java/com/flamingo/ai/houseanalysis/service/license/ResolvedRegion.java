package com.flamingo.ai.houseanalysis.service.license;

/** Hierarchical administrative codes for an address, from province down to dong. */
public record ResolvedRegion(String cityCode, String districtCode, String dongCode) {}
