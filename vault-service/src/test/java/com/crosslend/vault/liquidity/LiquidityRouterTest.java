package com.crosslend.vault.liquidity;

import com.crosslend.core.domain.LiquidityQuote;
import com.crosslend.core.domain.LiquiditySourceType;
import com.crosslend.core.domain.TransferStatus;
import com.crosslend.core.error.ErrorCode;
import com.crosslend.core.error.LendingException;
import com.crosslend.core.events.LendingEventPublisher;
import com.crosslend.core.events.LendingEventTypes;
import com.crosslend.vault.transfer.LiquidityTransferRequest;
import com.crosslend.vault.transfer.TransferRequestTable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class LiquidityRouterTest {

    private static final Instant NOW = Instant.parse("2026-03-02T00:00:00Z");
    private static final String ASSET = "0xa0b86991c6218b36c1d19d4a2e9eb0ce3606eb48";
    private static final String BORROWER = "0x00000000000000000000000000000000000a11ce";
    private static final BigInteger AMOUNT = BigInteger.valueOf(1_000_000);

    private LendingEventPublisher events;
    private TransferRequestTable transfers;
    private LiquidityRouter router;

    @BeforeEach
    void setUp() {
        events = mock(LendingEventPublisher.class);
        transfers = new TransferRequestTable(1L);
        router = new LiquidityRouter(transfers, events, Clock.fixed(NOW, ZoneId.of("UTC")), Duration.ofDays(30), 1L);
    }

    @Test
    void freeLocalLiquidityBeatsAFeeChargingBridge() {
        router.register(source("local-vault", false, quote("local-vault", AMOUNT, 0, 0, 0)));
        router.register(source("bridge:polygon", true, quote("bridge:polygon", AMOUNT, 10, 180, 0)));

        assertThat(router.route(ASSET, AMOUNT)).map(LiquidityQuote::sourceId).contains("local-vault");
    }

    @Test
    void ratesArePricedOverTheHoldingPeriod() {
        // 10 bps upfront vs 200 bps/year for 30 days (~16 bps)
        router.register(source("market:aave", false, quote("market:aave", AMOUNT, 0, 15, 200)));
        router.register(source("bridge:polygon", true, quote("bridge:polygon", AMOUNT, 10, 180, 0)));

        assertThat(router.route(ASSET, AMOUNT)).map(LiquidityQuote::sourceId).contains("bridge:polygon");
    }

    @Test
    void partialQuotesLoseToAnyFullOne() {
        router.register(source("local-vault", false, quote("local-vault", AMOUNT.divide(BigInteger.TWO), 0, 0, 0)));
        router.register(source("bridge:polygon", true, quote("bridge:polygon", AMOUNT, 25, 180, 0)));

        assertThat(router.route(ASSET, AMOUNT)).map(LiquidityQuote::sourceId).contains("bridge:polygon");
    }

    @Test
    void bestPartialQuoteIsReturnedWhenNothingCoversTheRequest() {
        router.register(source("local-vault", false, quote("local-vault", BigInteger.TEN, 0, 0, 0)));

        Optional<LiquidityQuote> route = router.route(ASSET, AMOUNT);

        assertThat(route).isPresent();
        assertThat(route.get().coversRequest()).isFalse();
    }

    @Test
    void tiesGoToTheFasterSourceThenToRegistrationOrder() {
        router.register(source("bridge:a", true, quote("bridge:a", AMOUNT, 10, 600, 0)));
        router.register(source("bridge:b", true, quote("bridge:b", AMOUNT, 10, 180, 0)));
        router.register(source("bridge:c", true, quote("bridge:c", AMOUNT, 10, 180, 0)));

        assertThat(router.route(ASSET, AMOUNT)).map(LiquidityQuote::sourceId).contains("bridge:b");
        assertThat(router.route(ASSET, AMOUNT)).map(LiquidityQuote::sourceId).contains("bridge:b");
    }

    @Test
    void sourceThatCannotQuoteIsSkipped() {
        LiquiditySource broken = source("market:down", false, null);
        when(broken.quote(anyString(), any())).thenThrow(new IllegalStateException("rpc down"));
        router.register(broken);
        router.register(source("bridge:polygon", true, quote("bridge:polygon", AMOUNT, 10, 180, 0)));

        assertThat(router.quotes(ASSET, AMOUNT)).extracting(LiquidityQuote::sourceId).containsExactly("bridge:polygon");
    }

    @Test
    void emptyQuotesAreDropped() {
        router.register(source("local-vault", false, quote("local-vault", BigInteger.ZERO, 0, 0, 0)));

        assertThat(router.route(ASSET, AMOUNT)).isEmpty();
    }

    @Test
    void duplicateSourceIdsAreRejected() {
        router.register(source("local-vault", false, null));

        assertThatThrownBy(() -> router.register(source("local-vault", false, null)))
                .satisfies(e -> assertThat(((LendingException) e).code()).isEqualTo(ErrorCode.ALREADY_REGISTERED));
    }

    @Test
    void asynchronousExecutionOpensAPendingRequest() {
        LiquiditySource bridge = source("bridge:polygon", true, null);
        when(bridge.borrow(eq(ASSET), eq(AMOUNT), eq(BORROWER), any()))
                .thenAnswer(inv -> new LiquiditySource.BorrowOutcome(true,
                        inv.<LiquiditySource.BorrowContext>getArgument(3).requestId(), "ccip", "0xabc"));
        router.register(bridge);

        LiquidityRouter.Execution execution = router.execute(quote("bridge:polygon", AMOUNT, 10, 180, 0), BORROWER, BORROWER);

        assertThat(execution.pending()).isTrue();
        assertThat(execution.fee()).isEqualTo(BigInteger.valueOf(1_000));
        assertThat(execution.debt()).isEqualTo(AMOUNT.add(BigInteger.valueOf(1_000)));
        LiquidityTransferRequest request = transfers.get(execution.requestId());
        assertThat(request.status()).isEqualTo(TransferStatus.PENDING);
        assertThat(request.messageId()).isEqualTo("0xabc");
        assertThat(request.createdAt()).isEqualTo(NOW);
        verify(events).publish(eq(LendingEventTypes.TRANSFER_INITIATED), any());
    }

    @Test
    void refusedAsynchronousBorrowOpensNothing() {
        LiquiditySource bridge = source("bridge:polygon", true, null);
        when(bridge.borrow(anyString(), any(), anyString(), any()))
                .thenReturn(new LiquiditySource.BorrowOutcome(false, "", null, null));
        router.register(bridge);

        assertThatThrownBy(() -> router.execute(quote("bridge:polygon", AMOUNT, 10, 180, 0), BORROWER, BORROWER))
                .satisfies(e -> assertThat(((LendingException) e).code()).isEqualTo(ErrorCode.SOURCE_UNAVAILABLE));
        assertThat(transfers.pending()).isEmpty();
    }

    @Test
    void completionNotifiesTheSourceOnce() {
        LiquiditySource bridge = source("bridge:polygon", true, null);
        when(bridge.borrow(anyString(), any(), anyString(), any()))
                .thenAnswer(inv -> new LiquiditySource.BorrowOutcome(true,
                        inv.<LiquiditySource.BorrowContext>getArgument(3).requestId(), "ccip", "0xabc"));
        router.register(bridge);
        String requestId = router.execute(quote("bridge:polygon", AMOUNT, 10, 180, 0), BORROWER, BORROWER).requestId();

        router.complete(requestId, true, null);

        ArgumentCaptor<LiquidityTransferRequest> resolved = ArgumentCaptor.forClass(LiquidityTransferRequest.class);
        verify(bridge).onTransferResolved(resolved.capture());
        assertThat(resolved.getValue().status()).isEqualTo(TransferStatus.COMPLETED);
        assertThatThrownBy(() -> router.complete(requestId, false, "again"))
                .satisfies(e -> assertThat(((LendingException) e).code()).isEqualTo(ErrorCode.INVALID_STATE));
        verify(bridge, times(1)).onTransferResolved(any());
    }

    @Test
    void unreachableSourceParksReturnedPrincipalUntilFlushed() {
        LiquiditySource bridge = source("bridge:polygon", true, null);
        doThrow(new LendingException(ErrorCode.BRIDGE_DISPATCH_FAILED, "relay down"))
                .doNothing()
                .when(bridge).repay(ASSET, AMOUNT);
        router.register(bridge);

        router.returnPrincipal("bridge:polygon", ASSET, AMOUNT);
        assertThat(router.pendingReturns()).containsExactly(new LiquidityRouter.PendingReturn("bridge:polygon", ASSET, AMOUNT));

        var flushed = router.flushPendingReturns();

        assertThat(flushed.successCount()).isEqualTo(1);
        assertThat(router.pendingReturns()).isEmpty();
        verify(bridge, times(2)).repay(ASSET, AMOUNT);
    }

    @Test
    void nonExternalReturnFailuresPropagate() {
        LiquiditySource local = source("local-vault", false, null);
        doThrow(new LendingException(ErrorCode.INSUFFICIENT_BALANCE, "short")).when(local).repay(ASSET, AMOUNT);
        router.register(local);

        assertThatThrownBy(() -> router.returnPrincipal("local-vault", ASSET, AMOUNT))
                .satisfies(e -> assertThat(((LendingException) e).code()).isEqualTo(ErrorCode.INSUFFICIENT_BALANCE));
        assertThat(router.pendingReturns()).isEmpty();
    }

    private static LiquiditySource source(String id, boolean async, LiquidityQuote quote) {
        LiquiditySource source = mock(LiquiditySource.class);
        when(source.id()).thenReturn(id);
        when(source.type()).thenReturn(async ? LiquiditySourceType.CROSS_CHAIN_BRIDGE : LiquiditySourceType.LOCAL_VAULT);
        when(source.isAsynchronous()).thenReturn(async);
        when(source.supportsAsset(ASSET)).thenReturn(true);
        if (quote != null) {
            when(source.quote(ASSET, AMOUNT)).thenReturn(quote);
        }
        return source;
    }

    private static LiquidityQuote quote(String sourceId, BigInteger available, long feeBps, long settlementSeconds,
                                        long annualRateBps) {
        return new LiquidityQuote(sourceId, LiquiditySourceType.CROSS_CHAIN_BRIDGE, "0x00000000000000000000000000000000000c0de2",
                137L, ASSET, AMOUNT, available, feeBps, settlementSeconds, annualRateBps);
    }
}
