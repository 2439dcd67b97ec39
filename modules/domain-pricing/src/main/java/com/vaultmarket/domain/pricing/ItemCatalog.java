package com.vaultmarket.domain.pricing;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/** Base prices of the items the vault buys and sells, keyed by item identifier. */
public class ItemCatalog {
  private final Map<String, ItemPriceRecord> records = new TreeMap<>();

  public ItemCatalog() {}

  public ItemCatalog(Collection<ItemPriceRecord> initial) {
    for (ItemPriceRecord record : initial) {
      records.put(record.item(), record);
    }
  }

  public ItemPriceRecord upsert(String item, long basePrice) {
    ItemPriceRecord record = new ItemPriceRecord(item == null ? null : item.trim(), basePrice);
    records.put(record.item(), record);
    return record;
  }

  public boolean remove(String item) {
    return records.remove(item) != null;
  }

  public Optional<ItemPriceRecord> find(String item) {
    if (item == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(records.get(item));
  }

  public boolean isPriced(String item) {
    return find(item).isPresent();
  }

  public List<ItemPriceRecord> all() {
    return List.copyOf(records.values());
  }
}
