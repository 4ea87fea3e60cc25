package com.crosslend.core.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Per-item outcome of a continue-on-error batch (timeout sweeps, multi-chain broadcasts).
 */
public final class BatchResult<K, V> {

  private final List<Item<K, V>> items = new ArrayList<>();

  public void succeeded(K key, V value) {
    items.add(new Item<>(key, true, value, null));
  }

  public void failed(K key, String error) {
    items.add(new Item<>(key, false, null, error));
  }

  public List<Item<K, V>> items() {
    return Collections.unmodifiableList(items);
  }

  public long successCount() {
    return items.stream().filter(Item::ok).count();
  }

  public long failureCount() {
    return items.size() - successCount();
  }

  public boolean allSucceeded() {
    return failureCount() == 0;
  }

  public record Item<K, V>(K key, boolean ok, V value, String error) {
  }
}
