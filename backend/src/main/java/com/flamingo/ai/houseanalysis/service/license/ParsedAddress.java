package com.flamingo.ai.houseanalysis.service.license;

/**
 * Administrative tokens parsed from a free-text Korean address.
 *
 * @param cityCode 2-digit province/metropolitan city code
 * @param cityName matched city name as written in the address
 * @param districtName first 구/군/시 token after the city, or null
 * @param dongName first 동/읍/면 token after the city, or null
 */
public record ParsedAddress(
    String cityCode, String cityName, String districtName, String dongName) {}
