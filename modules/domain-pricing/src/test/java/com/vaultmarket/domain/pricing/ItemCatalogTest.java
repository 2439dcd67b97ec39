package com.vaultmarket.domain.pricing;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class ItemCatalogTest {
  @Test
  void shouldUpsertAndListItemsSortedByIdentifier() {
    ItemCatalog catalog = new ItemCatalog();
    catalog.upsert("minecraft:iron_ingot", 10);
    catalog.upsert("minecraft:diamond", 100);
    catalog.upsert("minecraft:iron_ingot", 12);

    List<ItemPriceRecord> all = catalog.all();

    assertEquals(2, all.size());
    assertEquals("minecraft:diamond", all.get(0).item());
    assertEquals(12L, all.get(1).basePrice());
  }

  @Test
  void shouldRejectNonPositiveBasePriceOrBlankItem() {
    ItemCatalog catalog = new ItemCatalog();

    assertThrows(PricingDomainException.class, () -> catalog.upsert("minecraft:dirt", 0));
    assertThrows(PricingDomainException.class, () -> catalog.upsert("  ", 5));
    assertFalse(catalog.isPriced("minecraft:dirt"));
  }

  @Test
  void shouldRemoveItems() {
    ItemCatalog catalog = new ItemCatalog(List.of(new ItemPriceRecord("minecraft:gold_ingot", 30)));

    assertTrue(catalog.remove("minecraft:gold_ingot"));
    assertFalse(catalog.remove("minecraft:gold_ingot"));
    assertTrue(catalog.find("minecraft:gold_ingot").isEmpty());
  }
}
