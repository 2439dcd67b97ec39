package com.vaultmarket.ledgerserver.api;

public record ContainerItemsResponse(String container, String item, int requested, int moved) {}
