package com.crosslend.bridge.adapter;

import com.crosslend.bridge.inbound.InboundMessage;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.function.Consumer;

/**
 * Same-chain loopback. Messages never leave the process: they are handed straight to the inbound
 * sink (normally the bridge manager's receive path) and cost nothing.
 */
@Slf4j
public class LocalBridgeAdapter extends AbstractBridgeAdapter<Long> {

  public static final String PROTOCOL = "local";

  private final String chainName;
  private volatile Consumer<InboundMessage> inboundSink;

  public LocalBridgeAdapter(String chainName, long chainId) {
    this(PROTOCOL, chainName, chainId);
  }

  public LocalBridgeAdapter(String protocolName, String chainName, long chainId) {
    super(protocolName, ChainSelectorTable.of(Map.of(chainName, chainId)), null, null, FeeSchedule.free());
    this.chainName = ChainSelectorTable.normalizeName(chainName);
  }

  public void setInboundSink(Consumer<InboundMessage> inboundSink) {
    this.inboundSink = inboundSink;
  }

  @Override
  protected String dispatch(OutboundMessage<Long> message) {
    Consumer<InboundMessage> sink = inboundSink;
    if (sink == null) {
      log.debug("local message {} has no inbound sink, dropping delivery", message.messageId());
    } else {
      sink.accept(new InboundMessage(getProtocolName(), chainName, message.destination(), message.messageId(), message.payload()));
    }
    return message.messageId();
  }
}
