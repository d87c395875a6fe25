package com.flamingo.ai.houseanalysis.config;

import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the document analysis pipeline and its inference service. */
@Configuration
@ConfigurationProperties(prefix = "inference")
@Getter
@Setter
public class InferenceConfig {

  private OpenAi openai = new OpenAi();
  private Invocation invocation = new Invocation();
  private Rasterization rasterization = new Rasterization();
  private Intake intake = new Intake();

  @Getter
  @Setter
  public static class OpenAi {
    private String baseUrl = "https://api.openai.com";
    private String apiKey = "";
    private String model = "chatgpt-4o-latest";

    /** Purpose tag sent with every asset registration. */
    private String assetPurpose = "vision";

    /** Upper bound for a single asset registration call. */
    private Duration registrationTimeout = Duration.ofSeconds(60);

    /** Response buffer limit for the WebClient codecs. */
    private int maxInMemorySize = 4 * 1024 * 1024;
  }

  @Getter
  @Setter
  public static class Invocation {
    /** Hard wall-clock deadline for the completion call, measured from submission. */
    private Duration deadline = Duration.ofSeconds(90);

    /**
     * Extra time an abandoned completion may keep running before its HTTP call is cut off and the
     * thread released.
     */
    private Duration abandonGrace = Duration.ofSeconds(30);

    private int corePoolSize = 4;

    /** Upper bound on concurrent completion calls, abandoned ones included. */
    private int maxPoolSize = 256;
  }

  @Getter
  @Setter
  public static class Rasterization {
    private float dpi = 200f;
  }

  @Getter
  @Setter
  public static class Intake {
    /** Maximum size of a single uploaded file. */
    private long maxFileSizeBytes = 50 * 1024 * 1024L; // 50 MB
  }
}
