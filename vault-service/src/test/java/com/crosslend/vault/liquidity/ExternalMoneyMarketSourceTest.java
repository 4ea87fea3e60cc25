package com.crosslend.vault.liquidity;

import com.crosslend.bridge.adapter.BridgeAdapter;
import com.crosslend.bridge.payload.LiquidityInstruction;
import com.crosslend.bridge.payload.LiquidityInstructionCodec;
import com.crosslend.core.domain.RateMode;
import com.crosslend.vault.VaultFixture;
import com.crosslend.vault.VaultService;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.Map;

import static com.crosslend.vault.VaultFixture.ALICE;
import static com.crosslend.vault.VaultFixture.ETH;
import static com.crosslend.vault.VaultFixture.USDC;
import static com.crosslend.vault.VaultFixture.VAULT;
import static com.crosslend.vault.VaultFixture.eth;
import static com.crosslend.vault.VaultFixture.usdc;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class ExternalMoneyMarketSourceTest {

    private static final String POOL = "0x87870bca3f3fd6335c3f4ce8392d69350b4fa4e2";

    private final VaultFixture f = new VaultFixture();

    @Test
    void cheapMarketFundsTheBorrowImmediately() {
        // 50 bps a year over 30 days is well under the bridge's 10 bps fee
        f.router.register(new ExternalMoneyMarketSource(simulatedMarket(50), f.assets, VAULT));
        f.deposit(ALICE, USDC, usdc(10_000));

        VaultService.BorrowResult result = f.vault.borrow(ALICE, ETH, eth(1), null, RateMode.VARIABLE);

        assertThat(result.sourceId()).isEqualTo("market:aave");
        assertThat(result.requestId()).isNull();
        assertThat(result.fee()).isZero();
        assertThat(f.custody.balanceOf(ETH, ALICE)).isEqualTo(eth(1));
        assertThat(f.custody.balanceOf(ETH, POOL)).isEqualTo(eth(49));

        f.vault.repay(ALICE, ETH, eth(1), null);

        assertThat(f.custody.balanceOf(ETH, POOL)).isEqualTo(eth(50));
        assertThat(f.custody.balanceOf(ETH, VAULT)).isZero();
        assertThat(f.ledger.debt(ALICE, ETH)).isZero();
    }

    @Test
    void expensiveMarketLosesToTheBridge() {
        f.router.register(new ExternalMoneyMarketSource(simulatedMarket(450), f.assets, VAULT));

        assertThat(f.router.route(ETH, eth(1))).map(q -> q.sourceId()).contains("bridge:polygon");
    }

    @Test
    void adapterMarketSendsDistinctInstructionsForIdenticalRepayments() {
        BridgeAdapter adapter = mock(BridgeAdapter.class);
        when(adapter.sendMessage(anyString(), anyString(), any(), anyString())).thenReturn("0xmsg");
        AdapterMoneyMarket market = new AdapterMoneyMarket("aave", adapter, "ethereum", POOL, 1L, 450L, 15L,
                f.custody, Map.of(ETH, eth(5)));

        market.borrow(ETH, eth(2), ALICE);
        assertThat(market.availableLiquidity(ETH)).isEqualTo(eth(3));
        assertThat(f.custody.balanceOf(ETH, ALICE)).isEqualTo(eth(2));

        f.fund(VAULT, ETH, eth(2));
        market.repay(ETH, eth(1), VAULT);
        market.repay(ETH, eth(1), VAULT);

        ArgumentCaptor<byte[]> payloads = ArgumentCaptor.forClass(byte[].class);
        verify(adapter, times(3)).sendMessage(eq("ethereum"), eq(POOL), payloads.capture(), eq(ETH));
        List<LiquidityInstruction> sent = payloads.getAllValues().stream().map(LiquidityInstructionCodec::decode).toList();
        assertThat(sent).extracting(LiquidityInstruction::action).containsExactly(
                LiquidityInstruction.Action.RELEASE, LiquidityInstruction.Action.REPAY, LiquidityInstruction.Action.REPAY);
        assertThat(sent.get(1).requestId()).isNotEqualTo(sent.get(2).requestId());
        assertThat(market.availableLiquidity(ETH)).isEqualTo(eth(5));
        assertThat(f.custody.balanceOf(ETH, VAULT)).isZero();
    }

    private SimulatedMoneyMarket simulatedMarket(long annualRateBps) {
        f.fund(POOL, ETH, eth(50));
        return new SimulatedMoneyMarket("aave", POOL, 1L, annualRateBps, 15L, f.custody);
    }
}
