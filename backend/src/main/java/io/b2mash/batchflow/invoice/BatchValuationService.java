package io.b2mash.batchflow.invoice;

import io.b2mash.batchflow.batch.Batch;
import io.b2mash.batchflow.batch.BatchLineItem;
import io.b2mash.batchflow.batch.BatchLineItemRepository;
import io.b2mash.batchflow.invoice.dto.ValuatedLineItem;
import io.b2mash.batchflow.product.ProductCatalog;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Prices batches as the sum of quantity × production value over their line items. A line whose
 * product is unknown or unpriced is worth zero; valuation never fails.
 */
@Service
public class BatchValuationService {

  private final BatchLineItemRepository lineItemRepository;
  private final ProductCatalog productCatalog;

  public BatchValuationService(
      BatchLineItemRepository lineItemRepository, ProductCatalog productCatalog) {
    this.lineItemRepository = lineItemRepository;
    this.productCatalog = productCatalog;
  }

  @Transactional(readOnly = true)
  public BigDecimal valuateBatch(Batch batch) {
    return valuate(lineItemRepository.findByBatchId(batch.getId()));
  }

  /** Values of several batches keyed by batch id, using one line item and one price query. */
  @Transactional(readOnly = true)
  public Map<Long, BigDecimal> valuateBatches(Collection<Batch> batches) {
    var values = new HashMap<Long, BigDecimal>();
    if (batches.isEmpty()) {
      return values;
    }
    var batchIds = batches.stream().map(Batch::getId).toList();
    var itemsByBatch =
        lineItemRepository.findByBatchIds(batchIds).stream()
            .collect(Collectors.groupingBy(BatchLineItem::getBatchId));
    var prices = pricesFor(itemsByBatch.values().stream().flatMap(List::stream).toList());
    for (Long batchId : batchIds) {
      values.put(batchId, sum(itemsByBatch.getOrDefault(batchId, List.of()), prices));
    }
    return values;
  }

  public BigDecimal valuate(List<BatchLineItem> lineItems) {
    return sum(lineItems, pricesFor(lineItems));
  }

  @Transactional(readOnly = true)
  public List<ValuatedLineItem> valuatedLineItems(Long batchId) {
    var items = lineItemRepository.findByBatchId(batchId);
    var prices = pricesFor(items);
    return items.stream()
        .map(
            item -> {
              BigDecimal unitValue = unitValue(item, prices);
              return new ValuatedLineItem(
                  item.getId(),
                  item.getBatchId(),
                  item.getProductId(),
                  item.getQuantity(),
                  item.getSelectedColor(),
                  item.getSelectedSize(),
                  unitValue,
                  lineTotal(item, unitValue));
            })
        .toList();
  }

  private Map<Long, BigDecimal> pricesFor(List<BatchLineItem> lineItems) {
    var productIds =
        lineItems.stream()
            .map(BatchLineItem::getProductId)
            .filter(id -> id != null)
            .collect(Collectors.toSet());
    if (productIds.isEmpty()) {
      return Map.of();
    }
    return productCatalog.getProductionValues(productIds);
  }

  private static BigDecimal sum(List<BatchLineItem> lineItems, Map<Long, BigDecimal> prices) {
    return lineItems.stream()
        .map(item -> lineTotal(item, unitValue(item, prices)))
        .reduce(BigDecimal.ZERO, BigDecimal::add)
        .setScale(2, RoundingMode.HALF_UP);
  }

  private static BigDecimal unitValue(BatchLineItem item, Map<Long, BigDecimal> prices) {
    if (item.getProductId() == null) {
      return BigDecimal.ZERO;
    }
    return prices.getOrDefault(item.getProductId(), BigDecimal.ZERO);
  }

  private static BigDecimal lineTotal(BatchLineItem item, BigDecimal unitValue) {
    return unitValue
        .multiply(BigDecimal.valueOf(item.getQuantity()))
        .setScale(2, RoundingMode.HALF_UP);
  }
}
