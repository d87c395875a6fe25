package com.flamingo.ai.houseanalysis.service.license;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.houseanalysis.config.LicenseConfig;
import com.flamingo.ai.houseanalysis.exception.LicenseVerificationException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.util.MultiValueMap;

@ExtendWith(MockitoExtension.class)
@DisplayName("LicenseVerificationServiceImpl Tests")
class LicenseVerificationServiceImplTest {

  private static final String ADDRESS = "서울특별시 강남구 역삼동 823";

  @Mock private VworldClient vworldClient;

  private SimpleMeterRegistry meterRegistry;
  private LicenseVerificationServiceImpl service;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    service =
        new LicenseVerificationServiceImpl(
            new AddressParser(),
            new AdministrativeCodeResolver(vworldClient),
            vworldClient,
            new LicenseConfig(),
            meterRegistry);
  }

  @Test
  @DisplayName("Should verify when the registry reports exactly one match")
  @SuppressWarnings("unchecked")
  void shouldVerifySingleMatch() {
    stubRegions();
    when(vworldClient.searchBrokers(any()))
        .thenReturn("<div class=\"total\">총<b>1</b>건</div>");

    boolean verified = service.verify(ADDRESS, "역삼공인중개사", "11680-2019-00042");

    assertThat(verified).isTrue();
    ArgumentCaptor<MultiValueMap<String, String>> form =
        ArgumentCaptor.forClass(MultiValueMap.class);
    verify(vworldClient).searchBrokers(form.capture());
    assertThat(form.getValue().getFirst("sidoCd")).isEqualTo("11");
    assertThat(form.getValue().getFirst("sigunguCd")).isEqualTo("11680");
    assertThat(form.getValue().getFirst("dongCd")).isEqualTo("1168010100");
    assertThat(form.getValue().getFirst("v_lawd_cd")).isEqualTo("1168010100");
    assertThat(form.getValue().getFirst("svcCode")).isEqualTo("117");
    assertThat(form.getValue().getFirst("v_cmp_nm")).isEqualTo("역삼공인중개사");
    assertThat(form.getValue().getFirst("v_ra_regno")).isEqualTo("11680-2019-00042");
    assertThat(meterRegistry.counter("license.verified", "result", "true").count())
        .isEqualTo(1.0);
  }

  @Test
  @DisplayName("Should not verify when the registry reports no or several matches")
  void shouldNotVerifyOtherCounts() {
    stubRegions();
    when(vworldClient.searchBrokers(any()))
        .thenReturn("총<b>0</b>건")
        .thenReturn("총<b>12</b>건");

    assertThat(service.verify(ADDRESS, "없는중개사", "0000")).isFalse();
    assertThat(service.verify(ADDRESS, "중개사", "1168")).isFalse();
  }

  @Test
  @DisplayName("Should fail when the district is not in the code list")
  void shouldFailOnUnknownDistrict() {
    when(vworldClient.fetchChildRegions("11"))
        .thenReturn(List.of(new RegionCode("11110", "종로구")));

    assertThatThrownBy(() -> service.verify(ADDRESS, "중개사", "1"))
        .isInstanceOf(LicenseVerificationException.class)
        .hasMessageContaining("강남구");
    verify(vworldClient, never()).searchBrokers(any());
  }

  @Test
  @DisplayName("Should fail when the address names no province")
  void shouldFailOnUnparseableAddress() {
    assertThatThrownBy(() -> service.verify("somewhere", "중개사", "1"))
        .isInstanceOf(LicenseVerificationException.class);
  }

  private void stubRegions() {
    when(vworldClient.fetchChildRegions("11"))
        .thenReturn(
            List.of(new RegionCode("11110", "종로구"), new RegionCode("11680", "서울특별시 강남구")));
    when(vworldClient.fetchChildRegions("11680"))
        .thenReturn(
            List.of(
                new RegionCode("1168010100", "역삼동"), new RegionCode("1168010300", "개포동")));
  }
}
