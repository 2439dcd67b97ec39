package com.vaultmarket.tradeserver.api;

public record ContainerItemsResponse(String container, String item, int requested, int moved) {}
