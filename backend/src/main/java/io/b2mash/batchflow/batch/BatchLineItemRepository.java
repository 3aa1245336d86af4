package io.b2mash.batchflow.batch;

import java.util.Collection;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface BatchLineItemRepository extends JpaRepository<BatchLineItem, Long> {

  @Query("SELECT li FROM BatchLineItem li WHERE li.batchId = :batchId ORDER BY li.id")
  List<BatchLineItem> findByBatchId(@Param("batchId") Long batchId);

  @Query("SELECT li FROM BatchLineItem li WHERE li.batchId IN :batchIds ORDER BY li.batchId, li.id")
  List<BatchLineItem> findByBatchIds(@Param("batchIds") Collection<Long> batchIds);

  @Modifying
  @Query("DELETE FROM BatchLineItem li WHERE li.batchId = :batchId")
  int deleteByBatchId(@Param("batchId") Long batchId);
}
