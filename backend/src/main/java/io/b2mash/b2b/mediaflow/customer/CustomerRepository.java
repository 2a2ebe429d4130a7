package io.b2mash.b2b.mediaflow.customer;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface CustomerRepository extends JpaRepository<Customer, UUID> {

  @Query(
      """
      SELECT c FROM Customer c
      WHERE (:partnerId IS NULL OR c.partnerId = :partnerId)
      ORDER BY c.createdAt ASC
      """)
  List<Customer> findForPartner(@Param("partnerId") String partnerId);
}
