package io.b2mash.b2b.mediaflow.order;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Order lifecycle settings.
 *
 * @param reservationTtl how long a reserved order number stays confirmable
 * @param filesRetention how long after creation an order's delivered files are kept
 * @param defaultMaxRevisionRounds revision rounds granted to a new order unless overridden
 */
@ConfigurationProperties(prefix = "mediaflow.orders")
public record OrderProperties(
    Duration reservationTtl, Duration filesRetention, Integer defaultMaxRevisionRounds) {

  public OrderProperties {
    reservationTtl = reservationTtl != null ? reservationTtl : Duration.ofHours(2);
    filesRetention = filesRetention != null ? filesRetention : Duration.ofDays(30);
    defaultMaxRevisionRounds = defaultMaxRevisionRounds != null ? defaultMaxRevisionRounds : 2;
  }

  public static OrderProperties defaults() {
    return new OrderProperties(null, null, null);
  }
}
