package com.crosslend.core.events.payload;

public record BridgeMessageEvent(
    String protocolName,
    String chainName,
    String counterpartAddress,
    String messageId,
    int payloadBytes
) {
}
