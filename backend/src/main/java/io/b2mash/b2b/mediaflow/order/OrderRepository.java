package io.b2mash.b2b.mediaflow.order;

import jakarta.persistence.LockModeType;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface OrderRepository extends JpaRepository<Order, UUID> {

  Optional<Order> findByOrderNumber(String orderNumber);

  @Query(
      """
      SELECT o FROM WorkOrder o
      WHERE (:partnerId IS NULL OR o.partnerId = :partnerId)
      ORDER BY o.createdAt ASC
      """)
  List<Order> findForPartner(@Param("partnerId") String partnerId);

  @Query("SELECT o FROM WorkOrder o WHERE o.jobId = :jobId ORDER BY o.createdAt ASC")
  List<Order> findByJobId(@Param("jobId") UUID jobId);

  @Query("SELECT o FROM WorkOrder o WHERE o.assignedTo = :editorId ORDER BY o.createdAt ASC")
  List<Order> findByAssignedTo(@Param("editorId") String editorId);

  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query("SELECT o FROM WorkOrder o WHERE o.id = :id")
  Optional<Order> findWithLockById(@Param("id") UUID id);
}
