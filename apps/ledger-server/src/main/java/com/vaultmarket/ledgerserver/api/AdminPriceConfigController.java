package com.vaultmarket.ledgerserver.api;

import com.vaultmarket.ledgerserver.admin.LedgerAdminService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/admin/price-config")
public class AdminPriceConfigController {
  private final LedgerAdminService adminService;

  public AdminPriceConfigController(LedgerAdminService adminService) {
    this.adminService = adminService;
  }

  @GetMapping
  public ResponseEntity<PriceConfigResponse> get() {
    return ResponseEntity.ok(PriceConfigResponse.from(adminService.priceConfiguration()));
  }

  @PutMapping
  public ResponseEntity<PriceConfigResponse> update(
      @Valid @RequestBody UpdatePriceConfigRequest request) {
    return ResponseEntity.ok(
        PriceConfigResponse.from(
            adminService.updatePriceConfiguration(
                request.maxStock(),
                request.minPrice(),
                request.elasticity(),
                request.currencySymbol())));
  }
}
