package com.vaultmarket.tradeserver.api;

import com.vaultmarket.tradeserver.admin.VaultView;
import java.util.List;

public record VaultResponse(String vaultName, boolean attached, List<VaultView.Line> stock) {
  public static VaultResponse from(VaultView view) {
    return new VaultResponse(view.vaultName(), view.attached(), view.lines());
  }
}
