package com.crosslend.vault.ledger;

import com.crosslend.core.config.LendingProperties;
import com.crosslend.core.domain.Assets;
import com.crosslend.core.error.ErrorCode;
import com.crosslend.core.error.LendingException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Assets the vault accepts, keyed by lower-cased address.
 */
@Slf4j
public class AssetRegistry {

    private final Map<String, LendingProperties.Asset> byAddress = new ConcurrentHashMap<>();

    public AssetRegistry(List<LendingProperties.Asset> assets) {
        assets.forEach(this::list);
    }

    public void list(LendingProperties.Asset asset) {
        String address = Assets.normalize(asset.address());
        if (byAddress.putIfAbsent(address, asset) != null) {
            throw new LendingException(ErrorCode.ALREADY_REGISTERED, "asset " + address + " is already listed");
        }
        log.info("asset listed symbol={} address={} decimals={}", asset.symbol(), address, asset.decimals());
    }

    public boolean isSupported(String asset) {
        return asset != null && byAddress.containsKey(asset.trim().toLowerCase(Locale.ROOT));
    }

    /**
     * Normalizes {@code asset} and fails with UnsupportedAsset unless it is listed.
     */
    public String require(String asset) {
        String address = Assets.normalize(asset);
        if (!byAddress.containsKey(address)) {
            throw new LendingException(ErrorCode.UNSUPPORTED_ASSET, "asset " + address + " is not listed");
        }
        return address;
    }

    public Optional<String> addressOf(String symbol) {
        return byAddress.entrySet().stream()
                .filter(e -> e.getValue().symbol().equalsIgnoreCase(symbol))
                .map(Map.Entry::getKey)
                .findFirst();
    }

    public List<String> addresses() {
        return new ArrayList<>(byAddress.keySet());
    }
}
