package io.b2mash.batchflow.history;

import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface BatchHistoryRepository extends JpaRepository<BatchHistoryEntry, Long> {

  @Query(
      "SELECT h FROM BatchHistoryEntry h WHERE h.batchId = :batchId"
          + " ORDER BY h.occurredAt DESC, h.id DESC")
  List<BatchHistoryEntry> findByBatchIdNewestFirst(@Param("batchId") Long batchId);

  @Modifying
  @Query("DELETE FROM BatchHistoryEntry h WHERE h.batchId = :batchId")
  int deleteByBatchId(@Param("batchId") Long batchId);
}
