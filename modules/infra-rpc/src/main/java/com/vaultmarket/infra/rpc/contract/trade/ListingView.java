package com.vaultmarket.infra.rpc.contract.trade;

public record ListingView(long id, String seller, String item, long price, int quantityOnHand) {}
