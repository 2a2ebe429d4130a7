package io.b2mash.b2b.mediaflow.order;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface OrderLineRepository extends JpaRepository<OrderLine, UUID> {

  List<OrderLine> findByOrderIdOrderByCreatedAtAsc(UUID orderId);
}
