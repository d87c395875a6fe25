package com.flamingo.ai.houseanalysis.service.license;

import com.flamingo.ai.houseanalysis.exception.LicenseVerificationException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Splits a Korean address into province, district and dong tokens.
 *
 * <p>The province is the name from {@link #CITY_CODES} that appears earliest in the address, the
 * longest name winning a tie, so "경기도 광주시" resolves to 경기도 and not to 광주. The district
 * is the first whole token after the province ending in 구, 군 or 시; the dong is the first whole
 * token after the district ending in 동, 읍 or 면, so "강동구 천호동" yields 천호동 and not 강동.
 */
@Component
public class AddressParser {

  static final Map<String, String> CITY_CODES = new LinkedHashMap<>();

  static {
    register("11", "서울특별시", "서울시", "서울");
    register("26", "부산광역시", "부산시", "부산");
    register("27", "대구광역시", "대구시", "대구");
    register("28", "인천광역시", "인천시", "인천");
    register("29", "광주광역시", "광주시", "광주");
    register("30", "대전광역시", "대전시", "대전");
    register("31", "울산광역시", "울산시", "울산");
    register("36", "세종특별자치시", "세종시", "세종");
    register("41", "경기도");
    register("43", "충청북도", "충북");
    register("44", "충청남도", "충남");
    register("46", "전라남도", "전남");
    register("47", "경상북도", "경북");
    register("48", "경상남도", "경남");
    register("50", "제주특별자치도", "제주도", "제주");
    register("51", "강원특별자치도", "강원도", "강원");
    register("52", "전북특별자치도", "전라북도", "전북");
  }

  private static final Pattern DISTRICT = Pattern.compile("(\\S+[구군시])(?=\\s|$)");
  private static final Pattern DONG = Pattern.compile("(\\S+[동읍면])(?=\\s|$)");

  private static void register(String code, String... names) {
    for (String name : names) {
      CITY_CODES.put(name, code);
    }
  }

  public ParsedAddress parse(String address) {
    if (address == null || address.isBlank()) {
      throw new LicenseVerificationException("Address is empty");
    }

    String cityName = null;
    int cityIndex = Integer.MAX_VALUE;
    for (String candidate : CITY_CODES.keySet()) {
      int index = address.indexOf(candidate);
      if (index < 0) {
        continue;
      }
      if (index < cityIndex || (index == cityIndex && candidate.length() > cityName.length())) {
        cityName = candidate;
        cityIndex = index;
      }
    }
    if (cityName == null) {
      throw new LicenseVerificationException("No province or city found in address: " + address);
    }

    String afterCity = address.substring(cityIndex + cityName.length());
    Matcher district = DISTRICT.matcher(afterCity);
    String districtName = null;
    int dongFrom = 0;
    if (district.find()) {
      districtName = district.group(1);
      dongFrom = district.end();
    }

    Matcher dong = DONG.matcher(afterCity);
    String dongName = dong.find(dongFrom) ? dong.group(1) : null;
    return new ParsedAddress(CITY_CODES.get(cityName), cityName, districtName, dongName);
  }
}
