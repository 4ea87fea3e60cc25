package com.crosslend.vault.web;

import com.crosslend.core.domain.Assets;
import com.crosslend.core.domain.RateMode;
import com.crosslend.vault.HealthFactor;
import com.crosslend.vault.VaultService;
import com.crosslend.vault.ledger.CollateralLedger;
import com.crosslend.vault.ledger.PoolState;
import com.crosslend.vault.ledger.Position;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;

/**
 * User operations. The acting account is taken from the {@code X-Caller} header; authenticating it
 * is the gateway's job.
 */
@RestController
@RequestMapping("/api/vault")
@Validated
@RequiredArgsConstructor
public class VaultController {

    static final String CALLER = "X-Caller";

    private final @NonNull VaultService vault;
    private final @NonNull CollateralLedger ledger;

    @PostMapping("/deposit")
    public ResponseEntity<Void> deposit(@RequestHeader(CALLER) String caller, @Valid @RequestBody AmountRequest request) {
        vault.deposit(caller, request.asset(), request.amount());
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/withdraw")
    public ResponseEntity<Void> withdraw(@RequestHeader(CALLER) String caller, @Valid @RequestBody AmountRequest request) {
        vault.withdraw(caller, request.asset(), request.amount());
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/borrow")
    public ResponseEntity<VaultService.BorrowResult> borrow(@RequestHeader(CALLER) String caller,
                                                           @Valid @RequestBody BorrowRequest request) {
        return ResponseEntity.ok(vault.borrow(caller, request.asset(), request.amount(), request.onBehalfOf(), request.rateMode()));
    }

    @PostMapping("/repay")
    public ResponseEntity<VaultService.RepayResult> repay(@RequestHeader(CALLER) String caller,
                                                         @Valid @RequestBody RepayRequest request) {
        return ResponseEntity.ok(vault.repay(caller, request.asset(), request.amount(), request.onBehalfOf()));
    }

    @PostMapping("/rate-mode")
    public ResponseEntity<Void> switchRateMode(@RequestHeader(CALLER) String caller,
                                               @Valid @RequestBody RateModeRequest request) {
        vault.switchRateMode(caller, request.asset(), request.mode());
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/delegations")
    public ResponseEntity<Void> approveDelegation(@RequestHeader(CALLER) String caller,
                                                  @Valid @RequestBody DelegationRequest request) {
        vault.approveDelegation(caller, request.delegatee(), request.asset(), request.amount());
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/liquidate")
    public ResponseEntity<VaultService.LiquidationResult> liquidate(@RequestHeader(CALLER) String caller,
                                                                   @Valid @RequestBody LiquidationRequest request) {
        return ResponseEntity.ok(vault.liquidate(caller, request.user(), request.debtAsset(), request.amount(),
                request.collateralAsset()));
    }

    @GetMapping("/positions/{user}")
    public ResponseEntity<PositionResponse> position(@PathVariable String user) {
        HealthFactor health = vault.healthFactor(user);
        String account = Assets.normalize(user);
        List<SlotView> slots = ledger.position(account)
                .map(Position::slots)
                .orElse(List.of())
                .stream()
                .filter(s -> s.getDeposited().signum() > 0 || s.hasDebt())
                .map(s -> new SlotView(s.getAsset(), s.getDeposited(), s.getBorrowed(), s.accruedInterest(), s.getRateMode()))
                .toList();
        return ResponseEntity.ok(new PositionResponse(account, health.collateralUsd(), health.borrowedUsd(),
                health.value(), slots));
    }

    @GetMapping("/pools")
    public ResponseEntity<List<PoolState.PoolSnapshot>> pools() {
        return ResponseEntity.ok(ledger.pools());
    }

    public record AmountRequest(@NotBlank String asset, @NotNull @Positive BigInteger amount) {
    }

    public record BorrowRequest(@NotBlank String asset, @NotNull @Positive BigInteger amount, String onBehalfOf,
                                RateMode rateMode) {
    }

    public record RepayRequest(@NotBlank String asset, @NotNull @Positive BigInteger amount, String onBehalfOf) {
    }

    public record RateModeRequest(@NotBlank String asset, @NotNull RateMode mode) {
    }

    public record DelegationRequest(@NotBlank String delegatee, @NotBlank String asset, @NotNull BigInteger amount) {
    }

    public record LiquidationRequest(@NotBlank String user, @NotBlank String debtAsset, @NotNull @Positive BigInteger amount,
                                     @NotBlank String collateralAsset) {
    }

    /**
     * @param healthFactor null when nothing is borrowed
     */
    public record PositionResponse(String user, BigDecimal collateralUsd, BigDecimal borrowedUsd, BigDecimal healthFactor,
                                   List<SlotView> slots) {
    }

    public record SlotView(String asset, BigInteger deposited, BigInteger borrowed, BigInteger accruedInterest,
                           RateMode rateMode) {
    }
}
