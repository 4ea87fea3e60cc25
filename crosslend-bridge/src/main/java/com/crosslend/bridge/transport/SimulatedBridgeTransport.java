package com.crosslend.bridge.transport;

import lombok.extern.slf4j.Slf4j;
import org.web3j.crypto.Hash;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * PAPER-mode transport: records every call and returns a deterministic pseudo transaction hash.
 * Failures can be scripted to exercise retry and degradation paths.
 */
@Slf4j
public class SimulatedBridgeTransport implements BridgeTransport {

  private final List<BridgeCall> submitted = Collections.synchronizedList(new ArrayList<>());
  private final AtomicLong sequence = new AtomicLong();
  private final AtomicInteger retryableFailures = new AtomicInteger();
  private final AtomicInteger permanentFailures = new AtomicInteger();
  private volatile BigInteger quotedFee;

  @Override
  public String submit(BridgeCall call) {
    if (retryableFailures.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
      throw new RetryableBridgeException("simulated transient failure for " + call.protocol());
    }
    if (permanentFailures.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
      throw new IllegalStateException("simulated rejection for " + call.protocol());
    }
    long seq = sequence.incrementAndGet();
    submitted.add(call);
    byte[] seed = (call.protocol() + "|" + call.target() + "|" + call.calldata() + "|" + seq)
        .getBytes(StandardCharsets.UTF_8);
    String txHash = Numeric.toHexString(Hash.sha3(seed));
    log.debug("simulated bridge tx protocol={} target={} hash={}", call.protocol(), call.target(), txHash);
    return txHash;
  }

  @Override
  public Optional<BigInteger> quoteFee(BridgeCall quoteCall) {
    return Optional.ofNullable(quotedFee);
  }

  public void failNext(int count, boolean retryable) {
    if (retryable) {
      retryableFailures.set(count);
    } else {
      permanentFailures.set(count);
    }
  }

  public void setQuotedFee(BigInteger fee) {
    this.quotedFee = fee;
  }

  public List<BridgeCall> submittedCalls() {
    synchronized (submitted) {
      return List.copyOf(submitted);
    }
  }
}
