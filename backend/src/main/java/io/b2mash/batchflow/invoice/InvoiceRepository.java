package io.b2mash.batchflow.invoice;

import jakarta.persistence.LockModeType;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface InvoiceRepository extends JpaRepository<Invoice, Long> {

  @Query("SELECT i FROM Invoice i ORDER BY i.createdAt DESC, i.id DESC")
  List<Invoice> findAllOrdered();

  @Query(
      "SELECT i FROM Invoice i WHERE i.workshopId = :workshopId"
          + " ORDER BY i.createdAt DESC, i.id DESC")
  List<Invoice> findByWorkshopId(@Param("workshopId") Long workshopId);

  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query("SELECT i FROM Invoice i WHERE i.id = :id")
  Optional<Invoice> findByIdForUpdate(@Param("id") Long id);
}
