package com.crosslend.vault.ledger;

import com.crosslend.core.domain.Assets;
import lombok.Getter;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Everything one user holds in the vault. Native balances live in their own slot; token balances
 * are keyed by asset address.
 */
@Getter
public class Position {

    private final String user;
    private final TokenCollateral nativeBalance;
    private final Map<String, TokenCollateral> tokens = new LinkedHashMap<>();
    private BigDecimal borrowedUSD = BigDecimal.ZERO;
    private Instant lastUpdate;

    Position(String user, Instant createdAt) {
        this.user = user;
        this.nativeBalance = new TokenCollateral(Assets.NATIVE, createdAt);
        this.lastUpdate = createdAt;
    }

    public BigInteger nativeCollateral() {
        return nativeBalance.getDeposited();
    }

    public BigInteger nativeDebt() {
        return nativeBalance.getBorrowed();
    }

    public Optional<TokenCollateral> find(String asset) {
        if (Assets.isNative(asset)) {
            return Optional.of(nativeBalance);
        }
        return Optional.ofNullable(tokens.get(asset));
    }

    public List<TokenCollateral> slots() {
        List<TokenCollateral> all = new ArrayList<>(tokens.size() + 1);
        all.add(nativeBalance);
        all.addAll(tokens.values());
        return all;
    }

    public boolean hasDebt() {
        return slots().stream().anyMatch(TokenCollateral::hasDebt);
    }

    TokenCollateral slot(String asset, Instant now) {
        if (Assets.isNative(asset)) {
            return nativeBalance;
        }
        return tokens.computeIfAbsent(asset, a -> new TokenCollateral(a, now));
    }

    void revalued(BigDecimal borrowedUSD, Instant now) {
        this.borrowedUSD = borrowedUSD;
        this.lastUpdate = now;
    }
}
