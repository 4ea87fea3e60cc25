package com.crosslend.bridge.adapter;

import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable bidirectional chain-name to selector mapping. Chain names are case-insensitive and
 * stored lower-case; selectors must be unique.
 *
 * @param <S> the protocol's selector type (numeric id, chain string, endpoint id, pool address)
 */
public final class ChainSelectorTable<S> {

  private final Map<String, S> byName;
  private final Map<S, String> bySelector;

  private ChainSelectorTable(Map<String, S> byName, Map<S, String> bySelector) {
    this.byName = byName;
    this.bySelector = bySelector;
  }

  public static <S> ChainSelectorTable<S> of(Map<String, S> mapping) {
    Map<String, S> byName = new LinkedHashMap<>();
    Map<S, String> bySelector = new LinkedHashMap<>();
    mapping.entrySet().stream()
        .sorted(Comparator.comparing((Map.Entry<String, S> entry) -> normalizeName(entry.getKey())))
        .forEach(entry -> {
          String name = normalizeName(entry.getKey());
          S selector = entry.getValue();
          if (selector == null) {
            throw new IllegalArgumentException("null selector for chain " + name);
          }
          if (byName.putIfAbsent(name, selector) != null) {
            throw new IllegalArgumentException("duplicate chain name " + name);
          }
          String previous = bySelector.putIfAbsent(selector, name);
          if (previous != null) {
            throw new IllegalArgumentException("selector " + selector + " mapped by both " + previous + " and " + name);
          }
        });
    return new ChainSelectorTable<>(Collections.unmodifiableMap(byName), Collections.unmodifiableMap(bySelector));
  }

  public static String normalizeName(String chainName) {
    return chainName == null ? "" : chainName.trim().toLowerCase(Locale.ROOT);
  }

  public Optional<S> selectorFor(String chainName) {
    return Optional.ofNullable(byName.get(normalizeName(chainName)));
  }

  public Optional<String> chainFor(S selector) {
    return Optional.ofNullable(bySelector.get(selector));
  }

  public boolean contains(String chainName) {
    return byName.containsKey(normalizeName(chainName));
  }

  public List<String> chainNames() {
    return List.copyOf(byName.keySet());
  }

  public int size() {
    return byName.size();
  }
}
