package io.b2mash.b2b.mediaflow.upload;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * @param defaultExpiry how long a {@code for_editing} upload stays available when the caller gives
 *     no explicit expiry
 */
@ConfigurationProperties(prefix = "mediaflow.uploads")
public record UploadProperties(Duration defaultExpiry) {

  public UploadProperties {
    defaultExpiry = defaultExpiry != null ? defaultExpiry : Duration.ofDays(30);
  }

  public static UploadProperties defaults() {
    return new UploadProperties(null);
  }
}
