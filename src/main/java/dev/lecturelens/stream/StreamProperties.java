package dev.lecturelens.stream;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Session stream settings, bound from {@code lecturelens.stream.*}. */
@Configuration
@ConfigurationProperties(prefix = "lecturelens.stream")
public class StreamProperties {

  /** When true, interim ({@code is_final=false}) fragments are dropped before buffering. */
  private boolean finalFragmentsOnly = true;

  public boolean isFinalFragmentsOnly() {
    return finalFragmentsOnly;
  }

  public void setFinalFragmentsOnly(boolean finalFragmentsOnly) {
    this.finalFragmentsOnly = finalFragmentsOnly;
  }
}
