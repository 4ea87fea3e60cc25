package com.crosslend.vault.web;

import com.crosslend.core.access.AccessControl;
import com.crosslend.core.config.LendingProperties;
import com.crosslend.core.domain.Assets;
import com.crosslend.core.domain.Role;
import com.crosslend.core.domain.SystemState;
import com.crosslend.core.oracle.StaticPriceOracle;
import com.crosslend.vault.VaultService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;

@RestController
@RequestMapping("/api/admin")
@Validated
@RequiredArgsConstructor
public class AdminController {

    private final @NonNull VaultService vault;
    private final @NonNull StaticPriceOracle oracle;
    private final @NonNull AccessControl access;

    @GetMapping("/state")
    public ResponseEntity<SystemState> state() {
        return ResponseEntity.ok(vault.state());
    }

    @PostMapping("/pause")
    public ResponseEntity<SystemState> pause(@RequestHeader(VaultController.CALLER) String caller) {
        vault.pause(caller);
        return ResponseEntity.ok(vault.state());
    }

    @PostMapping("/unpause")
    public ResponseEntity<SystemState> unpause(@RequestHeader(VaultController.CALLER) String caller) {
        vault.unpause(caller);
        return ResponseEntity.ok(vault.state());
    }

    @PostMapping("/roles/grant")
    public ResponseEntity<Void> grant(@RequestHeader(VaultController.CALLER) String caller, @Valid @RequestBody RoleRequest request) {
        vault.grantRole(caller, request.role(), request.account());
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/roles/revoke")
    public ResponseEntity<Void> revoke(@RequestHeader(VaultController.CALLER) String caller, @Valid @RequestBody RoleRequest request) {
        vault.revokeRole(caller, request.role(), request.account());
        return ResponseEntity.noContent().build();
    }

    /**
     * Adds the price feed, then lists the asset.
     */
    @PostMapping("/assets")
    public ResponseEntity<Void> listAsset(@RequestHeader(VaultController.CALLER) String caller,
                                          @Valid @RequestBody LendingProperties.Asset asset) {
        access.requireRole(Assets.normalize(caller), Role.OWNER);
        oracle.addFeed(asset);
        vault.listAsset(caller, asset);
        return ResponseEntity.noContent().build();
    }

    @PutMapping("/prices")
    public ResponseEntity<Void> setPrice(@RequestHeader(VaultController.CALLER) String caller,
                                         @Valid @RequestBody PriceRequest request) {
        access.requireRole(Assets.normalize(caller), Role.OWNER);
        oracle.setPrice(request.asset(), request.priceUsd());
        return ResponseEntity.noContent().build();
    }

    public record RoleRequest(@NotNull Role role, @NotBlank String account) {
    }

    public record PriceRequest(@NotBlank String asset, @NotNull @DecimalMin("0.0") BigDecimal priceUsd) {
    }
}
