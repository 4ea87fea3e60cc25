package com.crosslend.bridge.adapter;

import com.crosslend.bridge.config.BridgeProperties;
import com.crosslend.bridge.transport.BridgeCall;
import com.crosslend.bridge.transport.BridgeTransport;
import com.crosslend.bridge.transport.BroadcastUnconfirmedException;
import com.crosslend.bridge.transport.RetryPolicy;
import com.crosslend.core.domain.Assets;
import com.crosslend.core.error.ErrorCode;
import com.crosslend.core.error.LendingException;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AdapterDispatchTest {

  private static final String VAULT = "0x00000000000000000000000000000000000c0de2";
  private static final byte[] PAYLOAD = new byte[]{1, 2, 3};

  private final BridgeProperties.Ccip config = new BridgeProperties.Ccip(null, null, null, null, null, null, null);

  @Test
  void broadcastWithoutReceiptCountsAsSentAndIsNeverResent() {
    CountingTransport transport = new CountingTransport(attempt -> {
      throw new BroadcastUnconfirmedException("0xabc", "timed out waiting for receipt", null);
    });
    CcipBridgeAdapter adapter = new CcipBridgeAdapter(config, transport, new RetryPolicy(true, 3, 0, 0));

    String messageId = adapter.sendMessage("polygon", VAULT, PAYLOAD, Assets.NATIVE);
    adapter.sendMessage("polygon", VAULT, PAYLOAD, Assets.NATIVE);

    assertThat(transport.submits.get()).isEqualTo(1);
    assertThat(adapter.wasDispatched(messageId)).isTrue();
  }

  @Test
  void failedDispatchCanBeSentAgain() {
    CountingTransport transport = new CountingTransport(attempt -> {
      if (attempt == 1) {
        throw new IllegalStateException("reverted");
      }
      return "0xtx" + attempt;
    });
    CcipBridgeAdapter adapter = new CcipBridgeAdapter(config, transport, RetryPolicy.none());

    assertThatThrownBy(() -> adapter.sendMessage("polygon", VAULT, PAYLOAD, Assets.NATIVE))
        .isInstanceOf(LendingException.class)
        .satisfies(e -> assertThat(((LendingException) e).code()).isEqualTo(ErrorCode.BRIDGE_DISPATCH_FAILED));

    String messageId = adapter.sendMessage("polygon", VAULT, PAYLOAD, Assets.NATIVE);

    assertThat(transport.submits.get()).isEqualTo(2);
    assertThat(adapter.wasDispatched(messageId)).isTrue();
  }

  @Test
  void concurrentDuplicateDoesNotSendTwice() throws Exception {
    CountDownLatch entered = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    CountingTransport transport = new CountingTransport(attempt -> {
      entered.countDown();
      try {
        release.await(5, TimeUnit.SECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
      return "0xtx" + attempt;
    });
    CcipBridgeAdapter adapter = new CcipBridgeAdapter(config, transport, RetryPolicy.none());
    ExecutorService pool = Executors.newFixedThreadPool(2);
    try {
      Future<String> first = pool.submit(() -> adapter.sendMessage("polygon", VAULT, PAYLOAD, Assets.NATIVE));
      assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();
      Future<String> second = pool.submit(() -> adapter.sendMessage("polygon", VAULT, PAYLOAD, Assets.NATIVE));
      release.countDown();

      assertThat(second.get(5, TimeUnit.SECONDS)).isEqualTo(first.get(5, TimeUnit.SECONDS));
      assertThat(transport.submits.get()).isEqualTo(1);
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  void remembersOnlyTheMostRecentMessages() {
    CountingTransport transport = new CountingTransport(attempt -> "0xtx" + attempt);
    CcipBridgeAdapter adapter = new CcipBridgeAdapter(config, transport, RetryPolicy.none());

    String oldest = adapter.sendMessage("polygon", VAULT, payload(0), Assets.NATIVE);
    String newest = oldest;
    for (int i = 1; i <= AbstractBridgeAdapter.MAX_TRACKED_MESSAGES; i++) {
      newest = adapter.sendMessage("polygon", VAULT, payload(i), Assets.NATIVE);
    }

    assertThat(adapter.wasDispatched(oldest)).isFalse();
    assertThat(adapter.wasDispatched(newest)).isTrue();
  }

  private static byte[] payload(int i) {
    return ("msg-" + i).getBytes(StandardCharsets.UTF_8);
  }

  private static final class CountingTransport implements BridgeTransport {

    private final AtomicInteger submits = new AtomicInteger();
    private final Function<Integer, String> behaviour;

    private CountingTransport(Function<Integer, String> behaviour) {
      this.behaviour = behaviour;
    }

    @Override
    public String submit(BridgeCall call) {
      return behaviour.apply(submits.incrementAndGet());
    }

    @Override
    public Optional<BigInteger> quoteFee(BridgeCall quoteCall) {
      return Optional.empty();
    }
  }
}
