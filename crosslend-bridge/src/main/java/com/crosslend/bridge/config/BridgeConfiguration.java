package com.crosslend.bridge.config;

import com.crosslend.bridge.BridgeManager;
import com.crosslend.bridge.adapter.AxelarBridgeAdapter;
import com.crosslend.bridge.adapter.CcipBridgeAdapter;
import com.crosslend.bridge.adapter.LocalBridgeAdapter;
import com.crosslend.bridge.adapter.MessageRelayAdapter;
import com.crosslend.bridge.adapter.MoneyMarketAdapter;
import com.crosslend.bridge.transport.BridgeTransport;
import com.crosslend.bridge.transport.RetryPolicy;
import com.crosslend.bridge.transport.SimulatedBridgeTransport;
import com.crosslend.bridge.transport.Web3jBridgeTransport;
import com.crosslend.core.config.LendingProperties;
import com.crosslend.core.domain.ExecutionMode;
import com.crosslend.core.error.LendingException;
import com.crosslend.core.events.LendingEventPublisher;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the bridge layer: transport chosen by execution mode, one adapter per enabled protocol,
 * and the manager that routes between them.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(BridgeProperties.class)
public class BridgeConfiguration {

  @Bean
  public BridgeTransport bridgeTransport(LendingProperties lending, BridgeProperties bridge) {
    if (lending.mode() == ExecutionMode.LIVE) {
      log.info("bridge transport LIVE rpc={} chainId={}", bridge.onchain().rpcUrl(), bridge.onchain().chainId());
      return new Web3jBridgeTransport(bridge.onchain());
    }
    log.info("bridge transport PAPER (simulated)");
    return new SimulatedBridgeTransport();
  }

  @Bean
  public RetryPolicy bridgeRetryPolicy(BridgeProperties bridge) {
    BridgeProperties.Retry retry = bridge.retry();
    return new RetryPolicy(retry.enabled(), retry.maxAttempts(), retry.initialBackoffMillis(), retry.maxBackoffMillis());
  }

  @Bean
  public BridgeManager bridgeManager(
      LendingProperties lending,
      BridgeProperties bridge,
      BridgeTransport transport,
      RetryPolicy bridgeRetryPolicy,
      LendingEventPublisher events,
      Clock clock,
      MeterRegistry meterRegistry
  ) {
    BridgeManager manager = new BridgeManager(events, clock, meterRegistry);

    if (bridge.local().enabled()) {
      LocalBridgeAdapter local = new LocalBridgeAdapter(lending.chain().name(), lending.chain().chainId());
      local.setInboundSink(manager::receiveMessage);
      manager.registerAdapter(local);
    }
    if (bridge.ccip().enabled()) {
      manager.registerAdapter(new CcipBridgeAdapter(bridge.ccip(), transport, bridgeRetryPolicy));
    }
    if (bridge.axelar().enabled()) {
      manager.registerAdapter(new AxelarBridgeAdapter(bridge.axelar(), transport, bridgeRetryPolicy));
    }
    if (bridge.relay().enabled()) {
      manager.registerAdapter(new MessageRelayAdapter(bridge.relay(), transport, bridgeRetryPolicy));
    }
    if (bridge.moneyMarket().enabled() && !bridge.moneyMarket().pools().isEmpty()) {
      manager.registerAdapter(new MoneyMarketAdapter(bridge.moneyMarket(), transport, bridgeRetryPolicy));
    }

    bridge.preferred().forEach((chain, protocol) -> {
      try {
        manager.setPreferredProtocol(chain, protocol);
      } catch (LendingException e) {
        log.warn("ignoring bridge preference {} -> {}: {}", chain, protocol, e.getMessage());
      }
    });

    log.info("bridge manager ready protocols={}", manager.getRegisteredProtocols());
    return manager;
  }
}
