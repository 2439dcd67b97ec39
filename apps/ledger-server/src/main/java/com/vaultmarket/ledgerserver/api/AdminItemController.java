package com.vaultmarket.ledgerserver.api;

import com.vaultmarket.ledgerserver.admin.LedgerAdminService;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/admin/items")
public class AdminItemController {
  private final LedgerAdminService adminService;

  public AdminItemController(LedgerAdminService adminService) {
    this.adminService = adminService;
  }

  @GetMapping
  public ResponseEntity<List<ItemResponse>> list() {
    return ResponseEntity.ok(adminService.items().stream().map(ItemResponse::from).toList());
  }

  @PutMapping
  public ResponseEntity<ItemResponse> upsert(@Valid @RequestBody UpsertItemRequest request) {
    return ResponseEntity.ok(
        ItemResponse.from(adminService.upsertItem(request.item(), request.basePrice())));
  }

  @DeleteMapping("/{item}")
  public ResponseEntity<Void> remove(@PathVariable("item") String item) {
    if (!adminService.removeItem(item)) {
      return ResponseEntity.notFound().build();
    }
    return ResponseEntity.noContent().build();
  }
}
