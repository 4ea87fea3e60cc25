package com.crosslend.vault.inbound;

import com.crosslend.bridge.adapter.ChainSelectorTable;
import com.crosslend.bridge.inbound.InboundMessage;
import com.crosslend.bridge.inbound.InboundMessageHandler;
import com.crosslend.bridge.payload.LiquidityInstruction;
import com.crosslend.bridge.payload.LiquidityInstructionCodec;
import com.crosslend.core.domain.Assets;
import com.crosslend.vault.VaultService;
import com.crosslend.vault.liquidity.CrossChainBridgeSource;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;

/**
 * Applies instructions sent by the vaults on other chains: liquidity reports and the outcome of
 * releases we asked for. Only messages whose sender is the configured vault of their source chain
 * are trusted.
 */
@Slf4j
public class LiquidityInstructionHandler implements InboundMessageHandler {

    private final VaultService vault;
    private final List<CrossChainBridgeSource> remotes;

    public LiquidityInstructionHandler(VaultService vault, List<CrossChainBridgeSource> remotes) {
        this.vault = vault;
        this.remotes = List.copyOf(remotes);
    }

    @Override
    public void onMessage(InboundMessage message) {
        Optional<CrossChainBridgeSource> origin = originOf(message);
        if (origin.isEmpty()) {
            log.debug("ignoring {} message {} from {} on {}: not a known vault",
                    message.protocolName(), message.messageId(), message.sender(), message.sourceChain());
            return;
        }
        CrossChainBridgeSource source = origin.get();
        LiquidityInstruction instruction;
        try {
            instruction = LiquidityInstructionCodec.decode(message.payload());
        } catch (IllegalArgumentException e) {
            log.warn("undecodable instruction from {} messageId={}: {}", source.chainName(), message.messageId(), e.getMessage());
            return;
        }

        switch (instruction.action()) {
            case SYNC -> source.updateRemoteLiquidity(instruction.asset(), instruction.amount());
            case RELEASE_COMPLETED -> vault.resolveFromBridge(source.id(), instruction.requestId(), true, null);
            case RELEASE_FAILED -> vault.resolveFromBridge(source.id(), instruction.requestId(), false,
                    "release refused by " + source.chainName());
            default -> log.debug("instruction {} from {} needs no action here", instruction.action(), source.chainName());
        }
    }

    private Optional<CrossChainBridgeSource> originOf(InboundMessage message) {
        if (message.sourceChain() == null || message.sender() == null) {
            return Optional.empty();
        }
        String chain = ChainSelectorTable.normalizeName(message.sourceChain());
        return remotes.stream()
                .filter(r -> ChainSelectorTable.normalizeName(r.chainName()).equals(chain))
                .filter(r -> r.remoteVault().equals(Assets.normalize(message.sender())))
                .findFirst();
    }
}
