package com.vaultmarket.domain.pricing;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class PriceConfigurationTest {
  @Test
  void shouldExposeDefaults() {
    PriceConfiguration defaults = PriceConfiguration.defaults();

    assertEquals(1000L, defaults.maxStock());
    assertEquals(1L, defaults.minPrice());
    assertEquals(1.2d, defaults.elasticity());
    assertEquals("$", defaults.currencySymbol());
    assertEquals("$45", defaults.format(45));
  }

  @Test
  void shouldRejectInvalidAdminUpdates() {
    PriceConfiguration defaults = PriceConfiguration.defaults();

    assertThrows(PricingDomainException.class, () -> defaults.withMaxStock(0));
    assertThrows(PricingDomainException.class, () -> defaults.withMinPrice(-1));
    assertThrows(PricingDomainException.class, () -> defaults.withElasticity(-0.1d));
    assertThrows(PricingDomainException.class, () -> defaults.withElasticity(Double.NaN));
    assertThrows(PricingDomainException.class, () -> defaults.withCurrencySymbol(" "));
  }

  @Test
  void shouldAcceptZeroElasticityAndZeroFloor() {
    PriceConfiguration flat = PriceConfiguration.defaults().withElasticity(0).withMinPrice(0);

    assertEquals(0d, flat.elasticity());
    assertEquals(0L, flat.minPrice());
  }
}
