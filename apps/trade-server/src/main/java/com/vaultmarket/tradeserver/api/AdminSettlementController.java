package com.vaultmarket.tradeserver.api;

import com.vaultmarket.tradeserver.admin.TradeAdminService;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/admin/settlements")
public class AdminSettlementController {
  private static final int MAX_LIMIT = 500;

  private final TradeAdminService adminService;

  public AdminSettlementController(TradeAdminService adminService) {
    this.adminService = adminService;
  }

  @GetMapping
  public ResponseEntity<List<SettlementResponse>> recent(
      @RequestParam(name = "limit", defaultValue = "50") int limit) {
    if (limit <= 0 || limit > MAX_LIMIT) {
      throw new IllegalArgumentException("limit must be between 1 and " + MAX_LIMIT);
    }
    return ResponseEntity.ok(
        adminService.settlements(limit).stream().map(SettlementResponse::from).toList());
  }

  /** Purchases whose goods could not all be returned; each needs manual reconciliation. */
  @GetMapping("/unrecovered")
  public ResponseEntity<List<SettlementResponse>> unrecovered() {
    return ResponseEntity.ok(
        adminService.unrecoveredSettlements().stream().map(SettlementResponse::from).toList());
  }
}
