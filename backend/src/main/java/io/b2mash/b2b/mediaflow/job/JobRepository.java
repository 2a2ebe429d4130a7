package io.b2mash.b2b.mediaflow.job;

import jakarta.persistence.LockModeType;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface JobRepository extends JpaRepository<Job, UUID> {

  Optional<Job> findByJobId(String jobId);

  Optional<Job> findByDeliveryToken(String deliveryToken);

  @Query(
      """
      SELECT j FROM Job j
      WHERE (:partnerId IS NULL OR j.partnerId = :partnerId)
      ORDER BY j.createdAt ASC
      """)
  List<Job> findForPartner(@Param("partnerId") String partnerId);

  /** Loads the job holding a row lock until the surrounding transaction ends. */
  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query("SELECT j FROM Job j WHERE j.id = :id")
  Optional<Job> findWithLockById(@Param("id") UUID id);
}
