package com.vaultmarket.ledgerserver.admin;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

public record ContainerView(String name, int slots, Map<String, Integer> contents) {
  public ContainerView {
    contents = Collections.unmodifiableMap(new TreeMap<>(contents));
  }
}
