package com.crosslend.bridge.inbound;

import java.util.List;

public record InboundResult(
    String messageId,
    boolean duplicate,
    int handled,
    List<String> errors
) {
  public boolean ok() {
    return !duplicate && errors.isEmpty();
  }
}
