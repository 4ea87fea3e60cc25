package com.crosslend.bridge.inbound;

public interface InboundMessageHandler {

  /**
   * Must tolerate redelivery of a message whose earlier delivery partly failed.
   */
  void onMessage(InboundMessage message);
}
