package com.vaultmarket.tradeserver.api;

import com.vaultmarket.tradeserver.admin.TradeAdminService;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/admin/listings")
public class AdminListingController {
  private final TradeAdminService adminService;

  public AdminListingController(TradeAdminService adminService) {
    this.adminService = adminService;
  }

  @GetMapping
  public ResponseEntity<List<ListingResponse>> list() {
    return ResponseEntity.ok(
        adminService.listings().stream().map(ListingResponse::from).toList());
  }

  @GetMapping("/{listingId}")
  public ResponseEntity<ListingResponse> get(@PathVariable("listingId") long listingId) {
    return ResponseEntity.ok(ListingResponse.from(adminService.listing(listingId)));
  }
}
