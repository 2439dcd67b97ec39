package com.vaultmarket.ledgerserver.api;

import com.vaultmarket.ledgerserver.admin.LedgerAdminService;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/admin/audit")
public class AdminAuditController {
  private static final int MAX_LIMIT = 800;

  private final LedgerAdminService adminService;

  public AdminAuditController(LedgerAdminService adminService) {
    this.adminService = adminService;
  }

  @GetMapping
  public ResponseEntity<List<AuditEntryResponse>> tail(
      @RequestParam(name = "limit", defaultValue = "50") int limit) {
    if (limit <= 0 || limit > MAX_LIMIT) {
      throw new IllegalArgumentException("limit must be between 1 and " + MAX_LIMIT);
    }
    return ResponseEntity.ok(
        adminService.auditTail(limit).stream().map(AuditEntryResponse::from).toList());
  }
}
