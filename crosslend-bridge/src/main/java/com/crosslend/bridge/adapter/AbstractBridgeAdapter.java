package com.crosslend.bridge.adapter;

import com.crosslend.bridge.transport.BridgeCall;
import com.crosslend.bridge.transport.BroadcastUnconfirmedException;
import com.crosslend.bridge.transport.BridgeTransport;
import com.crosslend.bridge.transport.RetryPolicy;
import com.crosslend.bridge.transport.RetryableBridgeException;
import com.crosslend.core.domain.Assets;
import com.crosslend.core.error.ErrorCode;
import com.crosslend.core.error.LendingException;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.web3j.crypto.Hash;
import org.web3j.utils.Numeric;

import java.io.ByteArrayOutputStream;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Shared plumbing for adapters: chain-name resolution through the adapter's private selector table,
 * deterministic message ids, at-most-once dispatch per message id (the most recent
 * {@value #MAX_TRACKED_MESSAGES} ids are remembered), and bounded retries of
 * {@link RetryableBridgeException}s.
 *
 * @param <S> the protocol's chain selector type
 */
@Slf4j
public abstract class AbstractBridgeAdapter<S> implements BridgeAdapter {

  private final String protocolName;
  private final ChainSelectorTable<S> chains;
  private final BridgeTransport transport;
  private final RetryPolicy retry;
  private final FeeSchedule fees;

  static final int MAX_TRACKED_MESSAGES = 4_096;

  // message id -> source-chain tx hash, oldest evicted first
  private final Map<String, String> dispatched = Collections.synchronizedMap(new LinkedHashMap<>() {
    @Override
    protected boolean removeEldestEntry(Map.Entry<String, String> eldest) {
      return size() > MAX_TRACKED_MESSAGES;
    }
  });
  // message id -> dispatch in progress; a duplicate joins it instead of sending again
  private final Map<String, CompletableFuture<String>> inFlight = new ConcurrentHashMap<>();

  protected AbstractBridgeAdapter(
      @NonNull String protocolName,
      @NonNull ChainSelectorTable<S> chains,
      BridgeTransport transport,
      RetryPolicy retry,
      @NonNull FeeSchedule fees
  ) {
    this.protocolName = ProtocolName.validate(protocolName);
    this.chains = chains;
    this.transport = transport;
    this.retry = retry == null ? RetryPolicy.none() : retry;
    this.fees = fees;
  }

  @Override
  public final String sendMessage(String chainName, String destinationAddress, byte[] payload, String feeAsset) {
    S selector = requireSelector(chainName);
    String destination = Assets.normalize(destinationAddress);
    byte[] body = payload == null ? new byte[0] : payload;
    String fee = feeAsset == null || feeAsset.isBlank() ? Assets.NATIVE : Assets.normalize(feeAsset);

    String messageId = messageId(selector, destination, body);
    if (alreadyDispatched(messageId)) {
      return messageId;
    }
    CompletableFuture<String> claim = new CompletableFuture<>();
    CompletableFuture<String> running = inFlight.putIfAbsent(messageId, claim);
    if (running != null) {
      awaitDispatch(running);
      return messageId;
    }
    try {
      // the previous owner may have finished between the first check and the claim
      if (alreadyDispatched(messageId)) {
        claim.complete(dispatched.get(messageId));
        return messageId;
      }
      OutboundMessage<S> outbound = new OutboundMessage<>(
          ChainSelectorTable.normalizeName(chainName), selector, destination, body, fee, quote(selector, destination, body), messageId);
      String txHash = dispatch(outbound);
      dispatched.put(messageId, txHash);
      claim.complete(txHash);
      log.info("{} message sent chain={} selector={} destination={} messageId={} tx={}",
          protocolName, outbound.chainName(), selector, destination, messageId, txHash);
      return messageId;
    } catch (RuntimeException e) {
      claim.completeExceptionally(e);
      throw e;
    } finally {
      inFlight.remove(messageId, claim);
    }
  }

  @Override
  public final BigInteger estimateGas(String chainName, byte[] payload) {
    S selector = requireSelector(chainName);
    return quote(selector, null, payload == null ? new byte[0] : payload);
  }

  @Override
  public boolean isChainSupported(String chainName) {
    return chains.contains(chainName);
  }

  @Override
  public List<String> getSupportedChains() {
    return chains.chainNames();
  }

  @Override
  public String getProtocolName() {
    return protocolName;
  }

  public Optional<S> selectorFor(String chainName) {
    return chains.selectorFor(chainName);
  }

  public Optional<String> chainFor(S selector) {
    return chains.chainFor(selector);
  }

  public boolean wasDispatched(String messageId) {
    return dispatched.containsKey(messageId);
  }

  /**
   * Hands the message to the network. Return the source-chain tx hash (or a local receipt id).
   */
  protected abstract String dispatch(OutboundMessage<S> message);

  /**
   * Read-only call asking the network for its fee, when it has one.
   */
  protected Optional<BridgeCall> feeQuoteCall(S selector, byte[] payload) {
    return Optional.empty();
  }

  protected String submitWithRetry(BridgeCall call) {
    if (transport == null) {
      throw new IllegalStateException(protocolName + " has no transport");
    }
    int attempts = retry.attempts();
    RetryableBridgeException last = null;
    for (int attempt = 1; attempt <= attempts; attempt++) {
      try {
        return transport.submit(call);
      } catch (RetryableBridgeException e) {
        last = e;
        log.warn("{} dispatch attempt {}/{} failed: {}", protocolName, attempt, attempts, e.getMessage());
        if (attempt < attempts) {
          sleep(retry.backoffMillis(attempt));
        }
      } catch (BroadcastUnconfirmedException e) {
        // already on the network; resending would deliver twice
        log.warn("{} tx {} broadcast without receipt, treating as sent: {}", protocolName, e.txHash(), e.getMessage());
        return e.txHash();
      } catch (LendingException e) {
        throw e;
      } catch (RuntimeException e) {
        throw new LendingException(ErrorCode.BRIDGE_DISPATCH_FAILED, protocolName + " rejected call to " + call.target(), e);
      }
    }
    throw new LendingException(ErrorCode.BRIDGE_DISPATCH_FAILED,
        protocolName + " gave up after " + attempts + " attempts", last);
  }

  protected LendingException unsupportedFeeAsset(String feeAsset) {
    return new LendingException(ErrorCode.UNSUPPORTED_ASSET, protocolName + " cannot pay fees in " + feeAsset);
  }

  private BigInteger quote(S selector, String destination, byte[] payload) {
    if (transport != null) {
      Optional<BridgeCall> quoteCall = feeQuoteCall(selector, payload);
      if (quoteCall.isPresent()) {
        Optional<BigInteger> quoted = transport.quoteFee(quoteCall.get());
        if (quoted.isPresent()) {
          return quoted.get();
        }
      }
    }
    return fees.feeFor(payload.length);
  }

  private S requireSelector(String chainName) {
    return chains.selectorFor(chainName)
        .orElseThrow(() -> new LendingException(ErrorCode.UNSUPPORTED_CHAIN, protocolName + " does not serve " + chainName));
  }

  private String messageId(S selector, String destination, byte[] payload) {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    out.writeBytes(protocolName.getBytes(StandardCharsets.UTF_8));
    out.writeBytes(String.valueOf(selector).getBytes(StandardCharsets.UTF_8));
    out.writeBytes(Numeric.hexStringToByteArray(destination));
    out.writeBytes(payload);
    return Numeric.toHexString(Hash.sha3(out.toByteArray()));
  }

  private boolean alreadyDispatched(String messageId) {
    String existing = dispatched.get(messageId);
    if (existing == null) {
      return false;
    }
    log.debug("{} message {} already dispatched in tx {}, not resending", protocolName, messageId, existing);
    return true;
  }

  private static void awaitDispatch(CompletableFuture<String> running) {
    try {
      running.join();
    } catch (CompletionException e) {
      if (e.getCause() instanceof RuntimeException) {
        throw (RuntimeException) e.getCause();
      }
      throw e;
    }
  }

  private static void sleep(long millis) {
    if (millis <= 0) {
      return;
    }
    try {
      Thread.sleep(millis);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new LendingException(ErrorCode.BRIDGE_DISPATCH_FAILED, "interrupted during retry backoff", e);
    }
  }

  public record OutboundMessage<S>(
      String chainName,
      S selector,
      String destination,
      byte[] payload,
      String feeAsset,
      BigInteger fee,
      String messageId
  ) {
  }

  public record FeeSchedule(BigInteger baseFee, BigInteger feePerByte) {

    public static FeeSchedule free() {
      return new FeeSchedule(BigInteger.ZERO, BigInteger.ZERO);
    }

    public BigInteger feeFor(int payloadBytes) {
      return baseFee.add(feePerByte.multiply(BigInteger.valueOf(payloadBytes)));
    }
  }
}
