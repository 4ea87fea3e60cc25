package com.crosslend.vault.config;

import com.crosslend.bridge.BridgeManager;
import com.crosslend.core.access.AccessControl;
import com.crosslend.core.compliance.AllowListComplianceGate;
import com.crosslend.core.compliance.CompliancePolicy;
import com.crosslend.core.config.LendingProperties;
import com.crosslend.core.domain.Assets;
import com.crosslend.core.domain.ExecutionMode;
import com.crosslend.core.domain.Role;
import com.crosslend.core.events.LendingEventPublisher;
import com.crosslend.core.events.SpringLendingEventPublisher;
import com.crosslend.core.oracle.StaticPriceOracle;
import com.crosslend.core.rate.KinkedInterestRateModel;
import com.crosslend.vault.VaultService;
import com.crosslend.vault.custody.AssetCustody;
import com.crosslend.vault.custody.InMemoryAssetCustody;
import com.crosslend.vault.flash.FlashLoanModule;
import com.crosslend.vault.inbound.LiquidityInstructionHandler;
import com.crosslend.vault.ledger.AssetRegistry;
import com.crosslend.vault.ledger.CollateralLedger;
import com.crosslend.vault.liquidity.AdapterMoneyMarket;
import com.crosslend.vault.liquidity.CrossChainBridgeSource;
import com.crosslend.vault.liquidity.ExternalMoneyMarket;
import com.crosslend.vault.liquidity.ExternalMoneyMarketSource;
import com.crosslend.vault.liquidity.LiquidityRouter;
import com.crosslend.vault.liquidity.LocalVaultSource;
import com.crosslend.vault.liquidity.SimulatedMoneyMarket;
import com.crosslend.vault.transfer.TransferRequestTable;
import com.crosslend.vault.transfer.TransferTimeoutSweeper;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.math.BigInteger;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Wires the vault: collaborators, ledger, liquidity sources in routing order (local first, then one
 * bridge source per remote chain, then the external market) and the service on top.
 */
@Slf4j
@Configuration
@EnableScheduling
@EnableConfigurationProperties(LendingProperties.class)
public class VaultConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public LendingEventPublisher lendingEventPublisher(ApplicationEventPublisher publisher, Clock clock) {
        return new SpringLendingEventPublisher(publisher, clock);
    }

    @Bean
    public StaticPriceOracle priceOracle(LendingProperties properties) {
        return new StaticPriceOracle(properties.assets());
    }

    @Bean
    public AllowListComplianceGate complianceGate(LendingProperties properties) {
        return new AllowListComplianceGate(properties.compliance());
    }

    @Bean
    public CompliancePolicy compliancePolicy(AllowListComplianceGate gate, LendingProperties properties) {
        log.info("compliance mode {}", properties.compliance().mode());
        return new CompliancePolicy(gate, properties.compliance());
    }

    @Bean
    public AccessControl accessControl(LendingProperties properties) {
        AccessControl access = new AccessControl(properties.admin().owner());
        properties.admin().completionCallers().forEach(caller -> access.bootstrap(Role.COMPLETION_CALLER, caller));
        log.info("access control owner={} completionCallers={}", properties.admin().owner(), properties.admin().completionCallers());
        return access;
    }

    @Bean
    public AssetRegistry assetRegistry(LendingProperties properties) {
        return new AssetRegistry(properties.assets());
    }

    @Bean
    public AssetCustody assetCustody() {
        return new InMemoryAssetCustody();
    }

    @Bean
    public CollateralLedger collateralLedger(LendingProperties properties, StaticPriceOracle oracle, Clock clock) {
        return new CollateralLedger(KinkedInterestRateModel.from(properties.rates()), oracle, clock,
                properties.rates().stableRateLock());
    }

    @Bean
    public TransferRequestTable transferRequestTable(LendingProperties properties) {
        return new TransferRequestTable(properties.chain().chainId());
    }

    @Bean
    public LiquidityRouter liquidityRouter(
            LendingProperties properties,
            TransferRequestTable transfers,
            CollateralLedger ledger,
            AssetCustody custody,
            AssetRegistry assets,
            BridgeManager bridgeManager,
            LendingEventPublisher events,
            Clock clock
    ) {
        LendingProperties.Chain chain = properties.chain();
        String vault = Assets.normalize(chain.vaultAddress());
        LiquidityRouter router = new LiquidityRouter(transfers, events, clock,
                properties.router().expectedHoldingPeriod(), chain.chainId());
        router.register(new LocalVaultSource(ledger, custody, assets, vault, chain.chainId()));
        for (LendingProperties.RemoteChain remote : properties.remoteChains()) {
            router.register(new CrossChainBridgeSource(remote, bridgeManager, custody, assets, vault));
        }
        if (properties.moneyMarket().enabled()) {
            ExternalMoneyMarket market = moneyMarket(properties, custody, assets, bridgeManager);
            router.register(new ExternalMoneyMarketSource(market, assets, vault));
        }
        log.info("liquidity router ready sources={}", router.sourceOrder());
        return router;
    }

    @Bean
    public FlashLoanModule flashLoanModule(LendingProperties properties, AssetCustody custody, CollateralLedger ledger) {
        return new FlashLoanModule(custody, ledger, properties.flashLoan(), Assets.normalize(properties.chain().vaultAddress()));
    }

    @Bean
    public VaultService vaultService(
            CollateralLedger ledger,
            AssetRegistry assets,
            AssetCustody custody,
            LiquidityRouter router,
            TransferRequestTable transfers,
            FlashLoanModule flashLoans,
            CompliancePolicy compliance,
            AccessControl access,
            StaticPriceOracle oracle,
            LendingEventPublisher events,
            LendingProperties properties,
            Clock clock,
            MeterRegistry meterRegistry
    ) {
        VaultService vault = new VaultService(ledger, assets, custody, router, transfers, flashLoans, compliance, access,
                oracle, events, properties, clock, meterRegistry);
        log.info("vault ready chain={} chainId={} vault={} mode={}",
                properties.chain().name(), properties.chain().chainId(), vault.vaultAddress(), properties.mode());
        return vault;
    }

    @Bean
    public LiquidityInstructionHandler liquidityInstructionHandler(
            VaultService vault,
            LiquidityRouter router,
            BridgeManager bridgeManager
    ) {
        LiquidityInstructionHandler handler =
                new LiquidityInstructionHandler(vault, router.sourcesOf(CrossChainBridgeSource.class));
        bridgeManager.addInboundHandler(handler);
        return handler;
    }

    @Bean
    public TransferTimeoutSweeper transferTimeoutSweeper(VaultService vault) {
        return new TransferTimeoutSweeper(vault);
    }

    private static ExternalMoneyMarket moneyMarket(
            LendingProperties properties,
            AssetCustody custody,
            AssetRegistry assets,
            BridgeManager bridgeManager
    ) {
        LendingProperties.MoneyMarket config = properties.moneyMarket();
        Map<String, BigInteger> liquidity = new LinkedHashMap<>();
        config.liquidity().forEach((symbol, amount) -> assets.addressOf(symbol).ifPresentOrElse(
                address -> liquidity.put(address, amount),
                () -> log.warn("money market liquidity for unlisted asset {} ignored", symbol)));

        if (properties.mode() == ExecutionMode.LIVE) {
            return bridgeManager.adapter("money-market")
                    .<ExternalMoneyMarket>map(adapter -> new AdapterMoneyMarket(config.name(), adapter, properties.chain().name(),
                            config.address(), properties.chain().chainId(), config.annualRateBps(), config.settlementSeconds(),
                            custody, liquidity))
                    .orElseGet(() -> {
                        log.warn("LIVE mode without a money-market adapter, simulating {}", config.name());
                        return simulated(config, properties, custody, liquidity);
                    });
        }
        return simulated(config, properties, custody, liquidity);
    }

    private static ExternalMoneyMarket simulated(
            LendingProperties.MoneyMarket config,
            LendingProperties properties,
            AssetCustody custody,
            Map<String, BigInteger> liquidity
    ) {
        String address = Assets.normalize(config.address());
        liquidity.forEach((asset, amount) -> {
            if (amount.signum() > 0) {
                custody.mint(asset, address, amount);
            }
        });
        return new SimulatedMoneyMarket(config.name(), address, properties.chain().chainId(),
                config.annualRateBps(), config.settlementSeconds(), custody);
    }
}
