package com.crosslend.vault.custody;

import com.crosslend.core.error.ErrorCode;
import com.crosslend.core.error.LendingException;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;

/**
 * Balance book for PAPER mode and tests. All methods are synchronized so a snapshot is always
 * consistent with the transfers around it.
 */
@Slf4j
public class InMemoryAssetCustody implements AssetCustody {

    private final Map<String, Map<String, BigInteger>> balances = new HashMap<>();

    @Override
    public synchronized BigInteger balanceOf(String asset, String account) {
        return balances.getOrDefault(asset, Map.of()).getOrDefault(account, BigInteger.ZERO);
    }

    @Override
    public synchronized void transfer(String asset, String from, String to, BigInteger amount) {
        requirePositive(amount);
        debit(asset, from, amount);
        credit(asset, to, amount);
    }

    @Override
    public synchronized void mint(String asset, String to, BigInteger amount) {
        requirePositive(amount);
        credit(asset, to, amount);
        log.debug("custody mint asset={} to={} amount={}", asset, to, amount);
    }

    @Override
    public synchronized void burn(String asset, String from, BigInteger amount) {
        requirePositive(amount);
        debit(asset, from, amount);
        log.debug("custody burn asset={} from={} amount={}", asset, from, amount);
    }

    @Override
    public synchronized CustodySnapshot snapshot() {
        Map<String, Map<String, BigInteger>> copy = new HashMap<>();
        balances.forEach((asset, accounts) -> copy.put(asset, Map.copyOf(accounts)));
        return new CustodySnapshot(copy);
    }

    @Override
    public synchronized void restore(CustodySnapshot snapshot) {
        balances.clear();
        snapshot.balances().forEach((asset, accounts) -> balances.put(asset, new HashMap<>(accounts)));
    }

    private void debit(String asset, String account, BigInteger amount) {
        BigInteger current = balanceOf(asset, account);
        if (current.compareTo(amount) < 0) {
            throw new LendingException(ErrorCode.INSUFFICIENT_BALANCE,
                    account + " holds " + current + " of " + asset + ", needs " + amount);
        }
        BigInteger left = current.subtract(amount);
        Map<String, BigInteger> accounts = balances.get(asset);
        if (left.signum() == 0) {
            accounts.remove(account);
        } else {
            accounts.put(account, left);
        }
    }

    private void credit(String asset, String account, BigInteger amount) {
        balances.computeIfAbsent(asset, a -> new HashMap<>()).merge(account, amount, BigInteger::add);
    }

    private static void requirePositive(BigInteger amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new LendingException(ErrorCode.ZERO_AMOUNT, "custody amount must be positive: " + amount);
        }
    }
}
