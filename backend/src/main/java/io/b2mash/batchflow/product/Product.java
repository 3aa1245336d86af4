package io.b2mash.batchflow.product;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;

/** Product master data. Only the production value (unit price paid to workshops) is used here. */
@Entity
@Table(name = "products")
public class Product {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "name", nullable = false, length = 255)
  private String name;

  @Column(name = "code", nullable = false, length = 100)
  private String code;

  @Column(name = "production_value", precision = 10, scale = 2)
  private BigDecimal productionValue;

  protected Product() {}

  public Product(String name, String code, BigDecimal productionValue) {
    this.name = name;
    this.code = code;
    this.productionValue = productionValue;
  }

  public Long getId() {
    return id;
  }

  public String getName() {
    return name;
  }

  public String getCode() {
    return code;
  }

  public BigDecimal getProductionValue() {
    return productionValue;
  }

  public void setProductionValue(BigDecimal productionValue) {
    this.productionValue = productionValue;
  }
}
