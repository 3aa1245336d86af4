package io.b2mash.batchflow.batch;

import java.time.LocalDate;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface BatchRepository extends JpaRepository<Batch, Long> {

  @Query("SELECT b FROM Batch b ORDER BY b.id DESC")
  List<Batch> findAllNewestFirst();

  /** Workshop of a batch, or null for internal work. Check existence first. */
  @Query("SELECT b.workshopId FROM Batch b WHERE b.id = :id")
  Long findWorkshopIdOf(@Param("id") Long id);

  @Query("SELECT b.code FROM Batch b")
  List<String> findAllCodes();

  /**
   * Open batches of a workshop still expected back after the given date, earliest return first.
   * Batches without an expected return date never conflict.
   */
  @Query(
      """
      SELECT b FROM Batch b
      WHERE b.workshopId = :workshopId
        AND b.status <> :returned
        AND b.expectedReturnDate > :cutDate
      ORDER BY b.expectedReturnDate ASC, b.id ASC
      """)
  List<Batch> findOpenReturningAfter(
      @Param("workshopId") Long workshopId,
      @Param("returned") BatchStatus returned,
      @Param("cutDate") LocalDate cutDate);

  /**
   * Candidates for a calendar period: cut on or before the period end and possibly still occupying
   * a day at or after the period start. Exact overlap is decided by the calendar layout.
   */
  @Query(
      """
      SELECT b FROM Batch b
      WHERE b.cutDate <= :periodEnd
        AND (b.cutDate >= :earliestCut
          OR b.expectedReturnDate >= :periodStart
          OR b.actualReturnDate >= :periodStart)
      ORDER BY b.cutDate ASC, b.id ASC
      """)
  List<Batch> findTouchingPeriod(
      @Param("periodStart") LocalDate periodStart,
      @Param("periodEnd") LocalDate periodEnd,
      @Param("earliestCut") LocalDate earliestCut);

  @Query(
      """
      SELECT b FROM Batch b
      WHERE b.workshopId = :workshopId
        AND b.paid = false
        AND b.cutDate BETWEEN :startDate AND :endDate
      ORDER BY b.cutDate DESC, b.id DESC
      """)
  List<Batch> findUnbilled(
      @Param("workshopId") Long workshopId,
      @Param("startDate") LocalDate startDate,
      @Param("endDate") LocalDate endDate);

  @Query("SELECT b FROM Batch b WHERE b.id IN :ids")
  List<Batch> findByIds(@Param("ids") List<Long> ids);
}
