package com.vaultmarket.ledgerserver.api;

import jakarta.validation.constraints.NotBlank;

public record RegisterAccountRequest(
    @NotBlank(message = "user is required") String user,
    @NotBlank(message = "credential is required") String credential) {}
