package com.flamingo.ai.houseanalysis.config;

import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

/** Configuration for broker license verification against the V-World portal. */
@Configuration
@ConfigurationProperties(prefix = "license")
@Getter
@Setter
public class LicenseConfig {

  private String baseUrl = "https://www.vworld.kr";
  private Duration timeout = Duration.ofSeconds(15);

  /** Service code of the broker registry search. */
  private String serviceCode = "117";

  private String userAgent =
      "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/537.36 (KHTML, like Gecko)"
          + " Chrome/138.0.0.0 Safari/537.36";

  @Bean(name = "vworldWebClient")
  public WebClient vworldWebClient() {
    return WebClient.builder()
        .baseUrl(baseUrl)
        .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(2 * 1024 * 1024))
        .build();
  }
}
