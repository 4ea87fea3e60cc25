package com.crosslend.core.events.payload;

import java.util.List;

public record AdapterRegistryEvent(
    String protocolName,
    String chainName,
    String previousProtocol,
    List<String> supportedChains
) {
}
