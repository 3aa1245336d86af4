package io.b2mash.batchflow.product;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class DatabaseProductCatalog implements ProductCatalog {

  private final ProductRepository productRepository;

  public DatabaseProductCatalog(ProductRepository productRepository) {
    this.productRepository = productRepository;
  }

  @Override
  @Transactional(readOnly = true)
  public Optional<BigDecimal> getProductionValue(Long productId) {
    if (productId == null) {
      return Optional.empty();
    }
    return productRepository.findById(productId).map(Product::getProductionValue);
  }

  @Override
  @Transactional(readOnly = true)
  public Map<Long, BigDecimal> getProductionValues(Collection<Long> productIds) {
    var values = new HashMap<Long, BigDecimal>();
    if (productIds.isEmpty()) {
      return values;
    }
    for (Product product : productRepository.findByIds(productIds)) {
      if (product.getProductionValue() != null) {
        values.put(product.getId(), product.getProductionValue());
      }
    }
    return values;
  }
}
