package io.b2mash.batchflow.workshop;

import jakarta.persistence.LockModeType;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface WorkshopRepository extends JpaRepository<Workshop, Long> {

  @Query("SELECT w FROM Workshop w ORDER BY w.scheduleOrder, w.id")
  List<Workshop> findAllInScheduleOrder();

  /** Row lock that serializes scheduling and billing writes for one workshop. */
  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query("SELECT w FROM Workshop w WHERE w.id = :id")
  Optional<Workshop> findByIdForUpdate(@Param("id") Long id);
}
