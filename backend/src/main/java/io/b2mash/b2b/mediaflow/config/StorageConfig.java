package io.b2mash.b2b.mediaflow.config;

import io.b2mash.b2b.mediaflow.audit.AuditEventRepository;
import io.b2mash.b2b.mediaflow.customer.CustomerRepository;
import io.b2mash.b2b.mediaflow.folder.FolderRecordRepository;
import io.b2mash.b2b.mediaflow.job.JobRepository;
import io.b2mash.b2b.mediaflow.offering.ServiceOfferingRepository;
import io.b2mash.b2b.mediaflow.order.OrderLineRepository;
import io.b2mash.b2b.mediaflow.order.OrderProperties;
import io.b2mash.b2b.mediaflow.order.OrderRepository;
import io.b2mash.b2b.mediaflow.order.OrderReservationRepository;
import io.b2mash.b2b.mediaflow.persistence.EntityStore;
import io.b2mash.b2b.mediaflow.persistence.jpa.JpaEntityStore;
import io.b2mash.b2b.mediaflow.persistence.memory.InMemoryEntityStore;
import io.b2mash.b2b.mediaflow.upload.EditorUploadRepository;
import io.b2mash.b2b.mediaflow.upload.UploadProperties;
import java.nio.file.Path;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties({
  StorageConfig.StorageProperties.class,
  OrderProperties.class,
  UploadProperties.class
})
public class StorageConfig {

  private static final Logger log = LoggerFactory.getLogger(StorageConfig.class);

  /**
   * @param backend {@code jpa} (default) or {@code memory}
   * @param snapshotFile snapshot location for the memory backend; blank keeps state in memory only
   */
  @ConfigurationProperties("mediaflow.storage")
  public record StorageProperties(String backend, String snapshotFile) {}

  @Bean
  @ConditionalOnMissingBean
  Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  @ConditionalOnProperty(name = "mediaflow.storage.backend", havingValue = "memory")
  EntityStore inMemoryEntityStore(StorageProperties properties) {
    Path snapshot =
        properties.snapshotFile() != null && !properties.snapshotFile().isBlank()
            ? Path.of(properties.snapshotFile())
            : null;
    log.info("Using in-memory entity store, snapshot={}", snapshot);
    return new InMemoryEntityStore(snapshot);
  }

  @Bean
  @ConditionalOnProperty(
      name = "mediaflow.storage.backend",
      havingValue = "jpa",
      matchIfMissing = true)
  EntityStore jpaEntityStore(
      CustomerRepository customerRepository,
      JobRepository jobRepository,
      OrderRepository orderRepository,
      OrderLineRepository orderLineRepository,
      ServiceOfferingRepository serviceOfferingRepository,
      OrderReservationRepository reservationRepository,
      EditorUploadRepository uploadRepository,
      FolderRecordRepository folderRepository,
      AuditEventRepository auditEventRepository) {
    log.info("Using JPA entity store");
    return new JpaEntityStore(
        customerRepository,
        jobRepository,
        orderRepository,
        orderLineRepository,
        serviceOfferingRepository,
        reservationRepository,
        uploadRepository,
        folderRepository,
        auditEventRepository);
  }
}
