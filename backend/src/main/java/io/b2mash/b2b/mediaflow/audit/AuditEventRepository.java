package io.b2mash.b2b.mediaflow.audit;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface AuditEventRepository extends JpaRepository<AuditEvent, UUID> {

  List<AuditEvent> findByJobIdOrderByOccurredAtAsc(UUID jobId);

  List<AuditEvent> findByOrderIdOrderByOccurredAtAsc(UUID orderId);
}
