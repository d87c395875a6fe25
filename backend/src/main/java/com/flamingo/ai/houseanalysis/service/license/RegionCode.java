package com.flamingo.ai.houseanalysis.service.license;

/** One entry of a legal-district code list. */
public record RegionCode(String code, String name) {}
