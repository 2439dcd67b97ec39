package com.vaultmarket.ledgerserver.api;

import com.vaultmarket.ledgerserver.admin.LedgerAdminService;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/admin/accounts")
public class AdminAccountController {
  private final LedgerAdminService adminService;

  public AdminAccountController(LedgerAdminService adminService) {
    this.adminService = adminService;
  }

  @PostMapping
  public ResponseEntity<AccountResponse> register(
      @Valid @RequestBody RegisterAccountRequest request) {
    return ResponseEntity.ok(
        AccountResponse.from(adminService.register(request.user(), request.credential())));
  }

  @GetMapping
  public ResponseEntity<List<AccountResponse>> list() {
    return ResponseEntity.ok(
        adminService.accounts().stream().map(AccountResponse::from).toList());
  }

  @GetMapping("/{user}")
  public ResponseEntity<AccountResponse> get(@PathVariable("user") String user) {
    return ResponseEntity.ok(AccountResponse.from(adminService.account(user)));
  }

  @PostMapping("/{user}/approve")
  public ResponseEntity<AccountResponse> approve(@PathVariable("user") String user) {
    return ResponseEntity.ok(AccountResponse.from(adminService.approve(user)));
  }

  @PostMapping("/{user}/adjustments")
  public ResponseEntity<AccountResponse> adjust(
      @PathVariable("user") String user, @Valid @RequestBody AdjustBalanceRequest request) {
    return ResponseEntity.ok(AccountResponse.from(adminService.adjust(user, request.delta())));
  }
}
