package io.b2mash.b2b.mediaflow.order;

import jakarta.persistence.LockModeType;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface OrderReservationRepository extends JpaRepository<OrderReservation, String> {

  List<OrderReservation> findByStatusOrderByReservedAtAsc(ReservationStatus status);

  /** Confirmation and expiry serialize on this row lock. */
  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query("SELECT r FROM OrderReservation r WHERE r.orderNumber = :orderNumber")
  Optional<OrderReservation> findWithLockByOrderNumber(@Param("orderNumber") String orderNumber);
}
