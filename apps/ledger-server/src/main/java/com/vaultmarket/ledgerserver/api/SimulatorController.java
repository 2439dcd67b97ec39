package com.vaultmarket.ledgerserver.api;

import com.vaultmarket.ledgerserver.admin.ContainerView;
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

/** Stands in for players placing goods into, or taking them out of, simulated containers. */
@RestController
@RequestMapping("/v1/admin/simulator/containers")
public class SimulatorController {
  private final LedgerAdminService adminService;

  public SimulatorController(LedgerAdminService adminService) {
    this.adminService = adminService;
  }

  @GetMapping
  public ResponseEntity<List<ContainerView>> list() {
    return ResponseEntity.ok(adminService.containers());
  }

  @GetMapping("/{name}")
  public ResponseEntity<ContainerView> get(@PathVariable("name") String name) {
    return ResponseEntity.ok(adminService.container(name));
  }

  @PostMapping("/{name}/insert")
  public ResponseEntity<ContainerItemsResponse> insert(
      @PathVariable("name") String name, @Valid @RequestBody ContainerItemsRequest request) {
    int moved = adminService.insert(name, request.item(), request.count());
    return ResponseEntity.ok(
        new ContainerItemsResponse(name, request.item(), request.count(), moved));
  }

  @PostMapping("/{name}/extract")
  public ResponseEntity<ContainerItemsResponse> extract(
      @PathVariable("name") String name, @Valid @RequestBody ContainerItemsRequest request) {
    int moved = adminService.extract(name, request.item(), request.count());
    return ResponseEntity.ok(
        new ContainerItemsResponse(name, request.item(), request.count(), moved));
  }
}
