package com.vaultmarket.tradeserver.api;

import com.vaultmarket.tradeserver.admin.TradeAdminService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/admin/vault")
public class AdminVaultController {
  private final TradeAdminService adminService;

  public AdminVaultController(TradeAdminService adminService) {
    this.adminService = adminService;
  }

  @GetMapping
  public ResponseEntity<VaultResponse> stock() {
    return ResponseEntity.ok(VaultResponse.from(adminService.vault()));
  }

  @PutMapping("/container")
  public ResponseEntity<VaultResponse> configure(
      @Valid @RequestBody ConfigureVaultRequest request) {
    adminService.configureVault(request.containerName());
    return ResponseEntity.ok(VaultResponse.from(adminService.vault()));
  }
}
