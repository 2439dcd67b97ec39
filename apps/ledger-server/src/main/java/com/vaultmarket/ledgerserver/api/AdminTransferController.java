package com.vaultmarket.ledgerserver.api;

import com.vaultmarket.ledgerserver.admin.LedgerAdminService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Transfer lookup for reconciling settlements whose charge outcome was unknown. */
@RestController
@RequestMapping("/v1/admin/transfers")
public class AdminTransferController {
  private final LedgerAdminService adminService;

  public AdminTransferController(LedgerAdminService adminService) {
    this.adminService = adminService;
  }

  @GetMapping("/{transferId}")
  public ResponseEntity<TransferResponse> get(@PathVariable("transferId") String transferId) {
    return adminService
        .transfer(transferId)
        .map(TransferResponse::from)
        .map(ResponseEntity::ok)
        .orElseGet(() -> ResponseEntity.notFound().build());
  }
}
