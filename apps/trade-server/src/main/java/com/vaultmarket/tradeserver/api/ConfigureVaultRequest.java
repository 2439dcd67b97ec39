package com.vaultmarket.tradeserver.api;

import jakarta.validation.constraints.NotBlank;

public record ConfigureVaultRequest(
    @NotBlank(message = "containerName is required") String containerName) {}
