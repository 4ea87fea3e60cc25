package com.crosslend.vault.transfer;

import com.crosslend.core.domain.TransferStatus;
import com.crosslend.core.error.ErrorCode;
import com.crosslend.core.error.LendingException;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TransferRequestTableTest {

    private static final String USER = "0x00000000000000000000000000000000000a11ce";
    private static final String ASSET = "0xa0b86991c6218b36c1d19d4a2e9eb0ce3606eb48";
    private static final Instant T0 = Instant.parse("2026-03-02T00:00:00Z");

    private final TransferRequestTable table = new TransferRequestTable(1L);

    @Test
    void requestIdsAreUniqueEvenForIdenticalInputs() {
        String a = table.nextRequestId(137L, USER, ASSET, BigInteger.TEN);
        String b = table.nextRequestId(137L, USER, ASSET, BigInteger.TEN);

        assertThat(a).isNotEqualTo(b);
        assertThat(a).matches("0x[0-9a-f]{64}");
    }

    @Test
    void resolvesExactlyOnce() {
        LiquidityTransferRequest request = pending("0x01", "bridge:polygon", T0);
        table.open(request);

        LiquidityTransferRequest done = table.resolve("0x01", TransferStatus.COMPLETED, null, T0.plusSeconds(5));

        assertThat(done.status()).isEqualTo(TransferStatus.COMPLETED);
        assertThat(done.resolvedAt()).isEqualTo(T0.plusSeconds(5));
        assertThatThrownBy(() -> table.resolve("0x01", TransferStatus.FAILED, "late", T0.plusSeconds(6)))
                .satisfies(e -> assertThat(((LendingException) e).code()).isEqualTo(ErrorCode.INVALID_STATE));
        assertThat(table.get("0x01").status()).isEqualTo(TransferStatus.COMPLETED);
    }

    @Test
    void rejectsUnknownAndDuplicateRequests() {
        table.open(pending("0x01", "bridge:polygon", T0));

        assertThatThrownBy(() -> table.open(pending("0x01", "bridge:polygon", T0)))
                .satisfies(e -> assertThat(((LendingException) e).code()).isEqualTo(ErrorCode.INVALID_STATE));
        assertThatThrownBy(() -> table.resolve("0x02", TransferStatus.COMPLETED, null, T0))
                .satisfies(e -> assertThat(((LendingException) e).code()).isEqualTo(ErrorCode.UNKNOWN_REQUEST));
        assertThatThrownBy(() -> table.resolve("0x01", TransferStatus.PENDING, null, T0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void lockedPrincipalCountsOnlyPendingRequests() {
        table.open(pending("0x01", "bridge:polygon", T0));
        table.open(pending("0x02", "bridge:polygon", T0.plusSeconds(1)));
        table.open(pending("0x03", "bridge:arbitrum", T0.plusSeconds(2)));
        table.resolve("0x02", TransferStatus.FAILED, "refused", T0.plusSeconds(3));

        assertThat(table.lockedPrincipal(USER, ASSET))
                .containsEntry("bridge:polygon", BigInteger.valueOf(101))
                .containsEntry("bridge:arbitrum", BigInteger.valueOf(101));
        assertThat(table.pendingCount()).isEqualTo(2);
        assertThat(table.pendingCreatedBefore(T0.plusSeconds(1))).extracting(LiquidityTransferRequest::requestId)
                .containsExactly("0x01");
        assertThat(table.forRequester(USER)).hasSize(3);
    }

    private static LiquidityTransferRequest pending(String id, String sourceId, Instant createdAt) {
        return new LiquidityTransferRequest(id, USER, USER, sourceId, 137L, 1L, ASSET, BigInteger.valueOf(100),
                BigInteger.ONE, createdAt, TransferStatus.PENDING, "ccip", "0xmsg", null, null);
    }
}
