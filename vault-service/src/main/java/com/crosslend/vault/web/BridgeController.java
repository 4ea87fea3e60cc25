package com.crosslend.vault.web;

import com.crosslend.bridge.BridgeManager;
import com.crosslend.bridge.inbound.InboundMessage;
import com.crosslend.bridge.inbound.InboundResult;
import com.crosslend.core.access.AccessControl;
import com.crosslend.core.domain.Assets;
import com.crosslend.core.domain.BatchResult;
import com.crosslend.core.domain.Role;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
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
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/bridge")
@Validated
@RequiredArgsConstructor
public class BridgeController {

    private final @NonNull BridgeManager bridge;
    private final @NonNull AccessControl access;

    @GetMapping("/adapters")
    public ResponseEntity<List<BridgeManager.AdapterRegistration>> adapters() {
        return ResponseEntity.ok(bridge.registrations());
    }

    @PutMapping("/preferred")
    public ResponseEntity<Void> setPreferred(@RequestHeader(VaultController.CALLER) String caller,
                                             @Valid @RequestBody PreferenceRequest request) {
        access.requireRole(Assets.normalize(caller), Role.OWNER);
        bridge.setPreferredProtocol(request.chain(), request.protocol());
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/estimate")
    public ResponseEntity<BigInteger> estimate(@RequestParam String chain, @RequestParam(defaultValue = "0x") String payload) {
        return ResponseEntity.ok(bridge.estimateGas(chain, Numeric.hexStringToByteArray(payload)));
    }

    @PostMapping("/broadcast")
    public ResponseEntity<BatchResult<String, String>> broadcast(@RequestHeader(VaultController.CALLER) String caller,
                                                                 @Valid @RequestBody BroadcastRequest request) {
        access.requireRole(Assets.normalize(caller), Role.OWNER);
        return ResponseEntity.ok(bridge.broadcastMessage(request.destinations(),
                Numeric.hexStringToByteArray(request.payload()), request.feeAsset()));
    }

    /**
     * Relayer delivery of a message received on this chain. Only COMPLETION_CALLER accounts relay.
     */
    @PostMapping("/inbound")
    public ResponseEntity<InboundResult> inbound(@RequestHeader(VaultController.CALLER) String caller,
                                                 @Valid @RequestBody InboundRequest request) {
        access.requireRole(Assets.normalize(caller), Role.COMPLETION_CALLER);
        return ResponseEntity.ok(bridge.receiveMessage(new InboundMessage(request.protocol(), request.sourceChain(),
                request.sender(), request.messageId(), Numeric.hexStringToByteArray(request.payload()))));
    }

    public record PreferenceRequest(@NotBlank String chain, @NotBlank String protocol) {
    }

    public record BroadcastRequest(@NotEmpty Map<String, String> destinations, @NotBlank String payload, String feeAsset) {
    }

    public record InboundRequest(@NotBlank String protocol, @NotBlank String sourceChain, @NotBlank String sender,
                                 @NotBlank String messageId, @NotBlank String payload) {
    }
}
