package io.b2mash.batchflow.invoice;

import jakarta.persistence.LockModeType;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface InvoiceCounterRepository extends JpaRepository<InvoiceCounter, String> {

  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query("SELECT c FROM InvoiceCounter c WHERE c.prefix = :prefix")
  Optional<InvoiceCounter> findByPrefixForUpdate(@Param("prefix") String prefix);

  /** Plain insert; fails with a unique-key violation if another caller created the row first. */
  @Modifying
  @Query(
      value = "INSERT INTO invoice_counters (prefix, next_number) VALUES (:prefix, :nextNumber)",
      nativeQuery = true)
  int insertCounter(@Param("prefix") String prefix, @Param("nextNumber") int nextNumber);
}
