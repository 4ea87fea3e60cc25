package com.crosslend.bridge;

import com.crosslend.bridge.adapter.BridgeAdapter;
import com.crosslend.bridge.adapter.LocalBridgeAdapter;
import com.crosslend.bridge.inbound.InboundMessage;
import com.crosslend.bridge.inbound.InboundResult;
import com.crosslend.core.domain.Assets;
import com.crosslend.core.domain.BatchResult;
import com.crosslend.core.error.ErrorCode;
import com.crosslend.core.error.LendingException;
import com.crosslend.core.events.LendingEventTypes;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BridgeManagerTest {

  private static final String VAULT = "0x00000000000000000000000000000000000c0de2";
  private static final byte[] PAYLOAD = new byte[]{1, 2, 3};

  private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
  private final List<String> publishedTypes = new ArrayList<>();
  private final BridgeManager manager = new BridgeManager(
      (type, payload) -> publishedTypes.add(type),
      Clock.fixed(Instant.parse("2026-01-05T00:00:00Z"), ZoneOffset.UTC),
      meterRegistry);

  @Test
  void duplicateProtocolNameIsRejectedAndOriginalKeepsServing() {
    RecordingAdapter original = new RecordingAdapter("ccip", "polygon");
    RecordingAdapter impostor = new RecordingAdapter("ccip", "polygon");
    manager.registerAdapter(original);

    assertThatThrownBy(() -> manager.registerAdapter(impostor))
        .isInstanceOf(LendingException.class)
        .satisfies(e -> assertThat(((LendingException) e).code()).isEqualTo(ErrorCode.ALREADY_REGISTERED));

    manager.sendMessage("polygon", VAULT, PAYLOAD);
    assertThat(original.sent).hasSize(1);
    assertThat(impostor.sent).isEmpty();
    assertThat(manager.getRegisteredProtocols()).containsExactly("ccip");
    assertThat(publishedTypes).containsExactly(LendingEventTypes.ADAPTER_REGISTERED, LendingEventTypes.MESSAGE_SENT);
  }

  @Test
  void fallsBackToFirstRegisteredAdapterUntilPreferenceIsSet() {
    RecordingAdapter ccip = new RecordingAdapter("ccip", "polygon", "arbitrum");
    RecordingAdapter axelar = new RecordingAdapter("axelar", "polygon");
    manager.registerAdapter(ccip);
    manager.registerAdapter(axelar);

    assertThat(manager.resolve("polygon")).isSameAs(ccip);

    manager.setPreferredProtocol("Polygon", "axelar");
    manager.sendMessage("polygon", VAULT, PAYLOAD);

    assertThat(axelar.sent).hasSize(1);
    assertThat(ccip.sent).isEmpty();
    assertThat(manager.preferredProtocol("polygon")).contains("axelar");
    assertThat(manager.resolve("arbitrum")).isSameAs(ccip);
  }

  @Test
  void rejectsPreferencesThatCannotBeHonoured() {
    manager.registerAdapter(new RecordingAdapter("ccip", "polygon"));

    assertThatThrownBy(() -> manager.setPreferredProtocol("polygon", "wormhole"))
        .satisfies(e -> assertThat(((LendingException) e).code()).isEqualTo(ErrorCode.UNKNOWN_PROTOCOL));
    assertThatThrownBy(() -> manager.setPreferredProtocol("base", "ccip"))
        .satisfies(e -> assertThat(((LendingException) e).code()).isEqualTo(ErrorCode.UNSUPPORTED_CHAIN));
  }

  @Test
  void unsupportedChainFailsSendAndEstimate() {
    manager.registerAdapter(new RecordingAdapter("ccip", "polygon"));

    assertThatThrownBy(() -> manager.sendMessage("solana", VAULT, PAYLOAD))
        .satisfies(e -> assertThat(((LendingException) e).code()).isEqualTo(ErrorCode.UNSUPPORTED_CHAIN));
    assertThatThrownBy(() -> manager.estimateGas("solana", PAYLOAD))
        .satisfies(e -> assertThat(((LendingException) e).code()).isEqualTo(ErrorCode.UNSUPPORTED_CHAIN));
    assertThat(manager.estimateGas("polygon", PAYLOAD)).isEqualTo(BigInteger.valueOf(3));
  }

  @Test
  void broadcastContinuesPastFailingChains() {
    manager.registerAdapter(new RecordingAdapter("ccip", "polygon", "arbitrum"));

    Map<String, String> destinations = new LinkedHashMap<>();
    destinations.put("polygon", VAULT);
    destinations.put("solana", VAULT);
    destinations.put("arbitrum", VAULT);

    BatchResult<String, String> result = manager.broadcastMessage(destinations, PAYLOAD, Assets.NATIVE);

    assertThat(result.successCount()).isEqualTo(2);
    assertThat(result.failureCount()).isEqualTo(1);
    assertThat(result.items()).extracting(BatchResult.Item::key).containsExactly("polygon", "solana", "arbitrum");
    assertThat(result.items().get(1).ok()).isFalse();
  }

  @Test
  void inboundMessagesAreDeliveredOnce() {
    List<InboundMessage> received = new ArrayList<>();
    manager.addInboundHandler(received::add);
    InboundMessage message = new InboundMessage("ccip", "polygon", VAULT, "0xabc", PAYLOAD);

    InboundResult first = manager.receiveMessage(message);
    InboundResult second = manager.receiveMessage(message);

    assertThat(first.ok()).isTrue();
    assertThat(second.duplicate()).isTrue();
    assertThat(received).hasSize(1);
    assertThat(meterRegistry.get("crosslend.bridge.messages.duplicate").counter().count()).isEqualTo(1.0);
  }

  @Test
  void failedHandlerAllowsRedelivery() {
    List<InboundMessage> received = new ArrayList<>();
    manager.addInboundHandler(m -> {
      throw new IllegalStateException("downstream unavailable");
    });
    manager.addInboundHandler(received::add);
    InboundMessage message = new InboundMessage("ccip", "polygon", VAULT, "0xdef", PAYLOAD);

    InboundResult first = manager.receiveMessage(message);
    InboundResult retry = manager.receiveMessage(message);

    assertThat(first.errors()).containsExactly("downstream unavailable");
    assertThat(first.handled()).isEqualTo(1);
    assertThat(retry.duplicate()).isFalse();
    assertThat(received).hasSize(2);
  }

  @Test
  void localAdapterLoopsBackThroughReceivePath() {
    LocalBridgeAdapter local = new LocalBridgeAdapter("ethereum", 1L);
    local.setInboundSink(manager::receiveMessage);
    manager.registerAdapter(local);
    List<InboundMessage> received = new ArrayList<>();
    manager.addInboundHandler(received::add);

    String messageId = manager.sendMessage("ethereum", VAULT, PAYLOAD);

    assertThat(received).singleElement().satisfies(m -> {
      assertThat(m.protocolName()).isEqualTo("local");
      assertThat(m.messageId()).isEqualTo(messageId);
      assertThat(m.payload()).containsExactly(PAYLOAD);
    });
    assertThat(manager.estimateGas("ethereum", PAYLOAD)).isZero();
  }

  @Test
  void latestVersionPicksHighestSuffix() {
    manager.registerAdapter(new RecordingAdapter("ccip", "polygon"));
    manager.registerAdapter(new RecordingAdapter("ccip-v3", "polygon"));
    manager.registerAdapter(new RecordingAdapter("ccip-v2", "polygon"));

    assertThat(manager.latestVersion("ccip")).contains("ccip-v3");
    assertThat(manager.latestVersion("axelar")).isEmpty();
  }

  private static final class RecordingAdapter implements BridgeAdapter {

    private final String name;
    private final List<String> chains;
    private final List<String> sent = new ArrayList<>();

    private RecordingAdapter(String name, String... chains) {
      this.name = name;
      this.chains = List.of(chains);
    }

    @Override
    public String sendMessage(String chainName, String destinationAddress, byte[] payload, String feeAsset) {
      String id = name + "-" + sent.size();
      sent.add(id);
      return id;
    }

    @Override
    public BigInteger estimateGas(String chainName, byte[] payload) {
      return BigInteger.valueOf(payload.length);
    }

    @Override
    public boolean isChainSupported(String chainName) {
      return chains.contains(chainName.toLowerCase());
    }

    @Override
    public List<String> getSupportedChains() {
      return chains;
    }

    @Override
    public String getProtocolName() {
      return name;
    }
  }
}
