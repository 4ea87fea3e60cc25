package com.crosslend.vault.transfer;

import com.crosslend.core.domain.BatchResult;
import com.crosslend.core.domain.TransferStatus;
import com.crosslend.vault.VaultService;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;

@RequiredArgsConstructor
@Slf4j
public class TransferTimeoutSweeper {

    private final @NonNull VaultService vault;

    @Scheduled(fixedDelayString = "${lending.transfers.sweep-interval-millis:60000}")
    public void tick() {
        try {
            BatchResult<String, TransferStatus> expired = vault.expireStaleTransfers();
            if (expired.failureCount() > 0) {
                log.warn("transfer sweep left {} stale requests unresolved", expired.failureCount());
            }
            vault.retryPendingReturns();
        } catch (Exception e) {
            log.warn("transfer sweep tick failed: {}", e.toString());
        }
    }
}
