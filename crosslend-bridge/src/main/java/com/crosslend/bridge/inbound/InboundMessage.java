package com.crosslend.bridge.inbound;

/**
 * A message delivered to this chain by a bridge network (via relayer callback or local loopback).
 */
public record InboundMessage(
    String protocolName,
    String sourceChain,
    String sender,
    String messageId,
    byte[] payload
) {
}
