package io.b2mash.batchflow.invoice;

import java.time.LocalDate;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface InvoiceBatchLinkRepository extends JpaRepository<InvoiceBatchLink, Long> {

  @Query("SELECT l FROM InvoiceBatchLink l WHERE l.invoiceId = :invoiceId ORDER BY l.id")
  List<InvoiceBatchLink> findByInvoiceId(@Param("invoiceId") Long invoiceId);

  /** Delete protection for batches: true when the batch was billed. */
  @Query(
      "SELECT CASE WHEN COUNT(l) > 0 THEN true ELSE false END FROM InvoiceBatchLink l"
          + " WHERE l.batchId = :batchId")
  boolean existsByBatchId(@Param("batchId") Long batchId);

  /** Batches of a workshop, cut in the range, that sit on an invoice already marked paid. */
  @Query(
      """
      SELECT COUNT(DISTINCT b.id) FROM Batch b, InvoiceBatchLink l, Invoice i
      WHERE l.batchId = b.id
        AND l.invoiceId = i.id
        AND b.workshopId = :workshopId
        AND i.status = :paidStatus
        AND b.cutDate BETWEEN :startDate AND :endDate
      """)
  long countSettledBatches(
      @Param("workshopId") Long workshopId,
      @Param("paidStatus") InvoiceStatus paidStatus,
      @Param("startDate") LocalDate startDate,
      @Param("endDate") LocalDate endDate);
}
