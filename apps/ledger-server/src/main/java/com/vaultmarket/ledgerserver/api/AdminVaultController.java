package com.vaultmarket.ledgerserver.api;

import com.vaultmarket.ledgerserver.admin.LedgerAdminService;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/admin/vault")
public class AdminVaultController {
  private final LedgerAdminService adminService;

  public AdminVaultController(LedgerAdminService adminService) {
    this.adminService = adminService;
  }

  @GetMapping
  public ResponseEntity<VaultResponse> stock() {
    List<VaultResponse.VaultStockLine> lines =
        adminService.vaultStock().stream()
            .map(
                quote ->
                    new VaultResponse.VaultStockLine(
                        quote.item(), quote.stock(), quote.price(), quote.basePrice()))
            .toList();
    return ResponseEntity.ok(new VaultResponse(adminService.vaultName(), lines));
  }

  @PutMapping("/container")
  public ResponseEntity<VaultResponse> configure(
      @Valid @RequestBody ConfigureVaultRequest request) {
    String vaultName = adminService.configureVault(request.containerName());
    return ResponseEntity.ok(new VaultResponse(vaultName, List.of()));
  }
}
