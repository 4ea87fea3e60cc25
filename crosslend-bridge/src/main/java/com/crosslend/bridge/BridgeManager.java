package com.crosslend.bridge;

import com.crosslend.bridge.adapter.BridgeAdapter;
import com.crosslend.bridge.adapter.ChainSelectorTable;
import com.crosslend.bridge.adapter.ProtocolName;
import com.crosslend.bridge.inbound.InboundMessage;
import com.crosslend.bridge.inbound.InboundMessageHandler;
import com.crosslend.bridge.inbound.InboundResult;
import com.crosslend.core.domain.Assets;
import com.crosslend.core.domain.BatchResult;
import com.crosslend.core.error.ErrorCode;
import com.crosslend.core.error.LendingException;
import com.crosslend.core.events.LendingEventPublisher;
import com.crosslend.core.events.LendingEventTypes;
import com.crosslend.core.events.payload.AdapterRegistryEvent;
import com.crosslend.core.events.payload.BridgeMessageEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Registry of bridge adapters keyed by protocol name, plus per-chain routing preferences.
 * <p>
 * Registration is append-only: a protocol name is never replaced or removed. Upgrading a protocol
 * means registering {@code name-vN} and pointing chain preferences at it.
 */
@Slf4j
public class BridgeManager {

  private final LendingEventPublisher events;
  private final Clock clock;

  private final Map<String, BridgeAdapter> adapters = new ConcurrentHashMap<>();
  // registration order drives the fallback when no preference is set
  private final List<AdapterRegistration> registrations = new CopyOnWriteArrayList<>();
  private final Map<String, String> preferred = new ConcurrentHashMap<>();

  private final List<InboundMessageHandler> handlers = new CopyOnWriteArrayList<>();
  private final Set<String> deliveredMessages = ConcurrentHashMap.newKeySet();

  private final Counter messagesSentCounter;
  private final Counter sendFailuresCounter;
  private final Counter messagesReceivedCounter;
  private final Counter duplicateMessagesCounter;

  public BridgeManager(@NonNull LendingEventPublisher events, @NonNull Clock clock, @NonNull MeterRegistry meterRegistry) {
    this.events = events;
    this.clock = clock;

    this.messagesSentCounter = Counter.builder("crosslend.bridge.messages.sent")
        .description("Bridge messages handed to an adapter")
        .register(meterRegistry);
    this.sendFailuresCounter = Counter.builder("crosslend.bridge.send.failures")
        .description("Bridge sends that failed after retries")
        .register(meterRegistry);
    this.messagesReceivedCounter = Counter.builder("crosslend.bridge.messages.received")
        .description("Inbound bridge messages accepted")
        .register(meterRegistry);
    this.duplicateMessagesCounter = Counter.builder("crosslend.bridge.messages.duplicate")
        .description("Inbound bridge messages dropped as already delivered")
        .register(meterRegistry);
    Gauge.builder("crosslend.bridge.adapters", registrations, List::size)
        .description("Registered bridge adapters")
        .register(meterRegistry);
  }

  public AdapterRegistration registerAdapter(@NonNull BridgeAdapter adapter) {
    String name = ProtocolName.validate(adapter.getProtocolName());
    AdapterRegistration registration;
    synchronized (registrations) {
      if (adapters.putIfAbsent(name, adapter) != null) {
        throw new LendingException(ErrorCode.ALREADY_REGISTERED, "protocol " + name + " is already registered");
      }
      registration = new AdapterRegistration(name, List.copyOf(adapter.getSupportedChains()), clock.instant());
      registrations.add(registration);
    }
    log.info("bridge adapter registered protocol={} chains={}", name, registration.supportedChains());
    events.publish(LendingEventTypes.ADAPTER_REGISTERED,
        new AdapterRegistryEvent(name, null, null, registration.supportedChains()));
    return registration;
  }

  public void setPreferredProtocol(String chainName, String protocolName) {
    String chain = ChainSelectorTable.normalizeName(chainName);
    BridgeAdapter adapter = adapters.get(protocolName);
    if (adapter == null) {
      throw new LendingException(ErrorCode.UNKNOWN_PROTOCOL, "no adapter registered as " + protocolName);
    }
    if (!adapter.isChainSupported(chain)) {
      throw new LendingException(ErrorCode.UNSUPPORTED_CHAIN, protocolName + " does not serve " + chain);
    }
    String previous = preferred.put(chain, protocolName);
    log.info("preferred bridge for {} set to {} (was {})", chain, protocolName, previous);
    events.publish(LendingEventTypes.PREFERRED_PROTOCOL_CHANGED,
        new AdapterRegistryEvent(protocolName, chain, previous, adapter.getSupportedChains()));
  }

  /**
   * Preferred adapter for the chain, else the earliest registered adapter that supports it.
   */
  public BridgeAdapter resolve(String chainName) {
    String chain = ChainSelectorTable.normalizeName(chainName);
    String preferredName = preferred.get(chain);
    if (preferredName != null) {
      BridgeAdapter adapter = adapters.get(preferredName);
      if (adapter != null && adapter.isChainSupported(chain)) {
        return adapter;
      }
    }
    for (AdapterRegistration registration : registrations) {
      BridgeAdapter adapter = adapters.get(registration.protocolName());
      if (adapter.isChainSupported(chain)) {
        return adapter;
      }
    }
    throw new LendingException(ErrorCode.UNSUPPORTED_CHAIN, "no bridge adapter supports chain " + chainName);
  }

  public String sendMessage(String chainName, String destinationAddress, byte[] payload) {
    return send(chainName, destinationAddress, payload, Assets.NATIVE).messageId();
  }

  public String sendMessage(String chainName, String destinationAddress, byte[] payload, String feeAsset) {
    return send(chainName, destinationAddress, payload, feeAsset).messageId();
  }

  /**
   * Like {@link #sendMessage} but also reports which protocol carried the message.
   */
  public Dispatch send(String chainName, String destinationAddress, byte[] payload, String feeAsset) {
    BridgeAdapter adapter = resolve(chainName);
    String messageId;
    try {
      messageId = adapter.sendMessage(chainName, destinationAddress, payload, feeAsset);
    } catch (RuntimeException e) {
      sendFailuresCounter.increment();
      throw e;
    }
    messagesSentCounter.increment();
    events.publish(LendingEventTypes.MESSAGE_SENT, new BridgeMessageEvent(
        adapter.getProtocolName(), ChainSelectorTable.normalizeName(chainName), destinationAddress, messageId,
        payload == null ? 0 : payload.length));
    return new Dispatch(adapter.getProtocolName(), ChainSelectorTable.normalizeName(chainName), messageId);
  }

  public BigInteger estimateGas(String chainName, byte[] payload) {
    return resolve(chainName).estimateGas(chainName, payload);
  }

  /**
   * Sends the same payload to several chains. A failing chain is recorded and the rest still go out.
   *
   * @param destinations chain name to destination address
   */
  public BatchResult<String, String> broadcastMessage(Map<String, String> destinations, byte[] payload, String feeAsset) {
    BatchResult<String, String> result = new BatchResult<>();
    destinations.forEach((chain, destination) -> {
      try {
        result.succeeded(chain, sendMessage(chain, destination, payload, feeAsset));
      } catch (LendingException e) {
        log.warn("broadcast to {} failed: {}", chain, e.getMessage());
        result.failed(chain, e.getMessage());
      }
    });
    log.info("broadcast finished sent={} failed={}", result.successCount(), result.failureCount());
    return result;
  }

  public void addInboundHandler(@NonNull InboundMessageHandler handler) {
    handlers.add(handler);
  }

  /**
   * Entry point for relayer callbacks and local loopback. A message id is delivered at most once per
   * protocol unless a handler failed, in which case redelivery is accepted.
   */
  public InboundResult receiveMessage(@NonNull InboundMessage message) {
    String key = message.protocolName() + ":" + message.messageId();
    if (!deliveredMessages.add(key)) {
      duplicateMessagesCounter.increment();
      log.debug("inbound message {} already delivered, ignoring", key);
      return new InboundResult(message.messageId(), true, 0, List.of());
    }
    messagesReceivedCounter.increment();
    events.publish(LendingEventTypes.MESSAGE_RECEIVED, new BridgeMessageEvent(
        message.protocolName(), message.sourceChain(), message.sender(), message.messageId(),
        message.payload() == null ? 0 : message.payload().length));

    int handled = 0;
    List<String> errors = new ArrayList<>();
    for (InboundMessageHandler handler : handlers) {
      try {
        handler.onMessage(message);
        handled++;
      } catch (RuntimeException e) {
        log.warn("inbound handler {} failed for {}: {}", handler.getClass().getSimpleName(), key, e.getMessage());
        errors.add(e.getMessage());
      }
    }
    if (!errors.isEmpty()) {
      deliveredMessages.remove(key);
    }
    return new InboundResult(message.messageId(), false, handled, List.copyOf(errors));
  }

  public List<String> getRegisteredProtocols() {
    return registrations.stream().map(AdapterRegistration::protocolName).toList();
  }

  public List<AdapterRegistration> registrations() {
    return List.copyOf(registrations);
  }

  public Optional<BridgeAdapter> adapter(String protocolName) {
    return Optional.ofNullable(adapters.get(protocolName));
  }

  public Optional<String> preferredProtocol(String chainName) {
    return Optional.ofNullable(preferred.get(ChainSelectorTable.normalizeName(chainName)));
  }

  /**
   * Highest registered version of a protocol family, e.g. {@code ccip-v3} when ccip, ccip-v2 and
   * ccip-v3 are all registered.
   */
  public Optional<String> latestVersion(String protocolBase) {
    return registrations.stream()
        .map(AdapterRegistration::protocolName)
        .filter(name -> ProtocolName.baseOf(name).equals(protocolBase))
        .max((a, b) -> Integer.compare(ProtocolName.versionOf(a), ProtocolName.versionOf(b)));
  }

  public record AdapterRegistration(String protocolName, List<String> supportedChains, Instant registeredAt) {
  }

  public record Dispatch(String protocolName, String chainName, String messageId) {
  }
}
