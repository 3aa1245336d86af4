package io.b2mash.batchflow.product;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;

/** Price lookup against the product catalog. */
public interface ProductCatalog {

  /**
   * Returns the unit production value of a product, or empty when the product is unknown or has no
   * value recorded.
   */
  Optional<BigDecimal> getProductionValue(Long productId);

  /** Bulk variant of {@link #getProductionValue(Long)}; unknown ids are absent from the map. */
  Map<Long, BigDecimal> getProductionValues(Collection<Long> productIds);
}
