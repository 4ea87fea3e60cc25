package com.crosslend.vault.web;

import com.crosslend.core.domain.Assets;
import com.crosslend.core.domain.LiquidityQuote;
import com.crosslend.vault.VaultService;
import com.crosslend.vault.flash.FlashLoanModule;
import com.crosslend.vault.ledger.AssetRegistry;
import com.crosslend.vault.liquidity.LiquidityRouter;
import com.crosslend.vault.transfer.LiquidityTransferRequest;
import com.crosslend.vault.transfer.TransferRequestTable;
import jakarta.validation.Valid;
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
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigInteger;
import java.util.List;

@RestController
@RequestMapping("/api/liquidity")
@Validated
@RequiredArgsConstructor
public class LiquidityController {

    private final @NonNull LiquidityRouter router;
    private final @NonNull TransferRequestTable transfers;
    private final @NonNull AssetRegistry assets;
    private final @NonNull FlashLoanModule flashLoans;
    private final @NonNull VaultService vault;

    @GetMapping("/quotes")
    public ResponseEntity<QuotesResponse> quotes(@RequestParam String asset, @RequestParam BigInteger amount) {
        String token = assets.require(asset);
        List<LiquidityQuote> quotes = router.quotes(token, amount);
        return ResponseEntity.ok(new QuotesResponse(quotes, router.select(quotes).orElse(null)));
    }

    @GetMapping("/flash-loan/fee")
    public ResponseEntity<BigInteger> flashLoanFee(@RequestParam BigInteger amount) {
        return ResponseEntity.ok(flashLoans.feeFor(amount));
    }

    @GetMapping("/transfers/pending")
    public ResponseEntity<List<LiquidityTransferRequest>> pending() {
        return ResponseEntity.ok(transfers.pending());
    }

    @GetMapping("/transfers/{requestId}")
    public ResponseEntity<LiquidityTransferRequest> transfer(@PathVariable String requestId) {
        return ResponseEntity.of(transfers.find(requestId));
    }

    @GetMapping("/transfers")
    public ResponseEntity<List<LiquidityTransferRequest>> forRequester(@RequestParam String requester) {
        return ResponseEntity.ok(transfers.forRequester(Assets.normalize(requester)));
    }

    /**
     * Relayer callback resolving a cross-chain transfer. Requires the COMPLETION_CALLER role.
     */
    @PostMapping("/transfers/{requestId}/complete")
    public ResponseEntity<LiquidityTransferRequest> complete(@RequestHeader(VaultController.CALLER) String caller,
                                                             @PathVariable String requestId,
                                                             @Valid @RequestBody CompletionRequest request) {
        return ResponseEntity.ok(vault.completeLiquidityTransfer(caller, requestId, request.success(), request.reason()));
    }

    @GetMapping("/returns/pending")
    public ResponseEntity<List<LiquidityRouter.PendingReturn>> pendingReturns() {
        return ResponseEntity.ok(router.pendingReturns());
    }

    public record QuotesResponse(List<LiquidityQuote> quotes, LiquidityQuote selected) {
    }

    public record CompletionRequest(boolean success, String reason) {
    }
}
