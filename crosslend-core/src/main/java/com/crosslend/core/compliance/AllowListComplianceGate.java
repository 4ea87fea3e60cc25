package com.crosslend.core.compliance;

import com.crosslend.core.config.LendingProperties;
import com.crosslend.core.domain.Assets;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Compliance gate backed by configured allow lists. Stands in for the identity registry in PAPER mode.
 */
@Slf4j
public class AllowListComplianceGate implements ComplianceGate {

  private final Set<String> verified = ConcurrentHashMap.newKeySet();
  private final Map<Long, Set<String>> claims = new ConcurrentHashMap<>();

  public AllowListComplianceGate(@NonNull LendingProperties.Compliance compliance) {
    compliance.verifiedAddresses().forEach(this::verify);
    for (Map.Entry<String, List<String>> entry : compliance.claimHolders().entrySet()) {
      long topic = Long.parseLong(entry.getKey().trim());
      entry.getValue().forEach(holder -> addClaim(holder, topic));
    }
  }

  public void verify(String address) {
    verified.add(Assets.normalize(address));
  }

  public void revoke(String address) {
    String normalized = Assets.normalize(address);
    verified.remove(normalized);
    claims.values().forEach(holders -> holders.remove(normalized));
    log.info("compliance revoked for {}", normalized);
  }

  public void addClaim(String address, long topicId) {
    claims.computeIfAbsent(topicId, t -> ConcurrentHashMap.newKeySet()).add(Assets.normalize(address));
  }

  @Override
  public boolean isVerified(String address) {
    return verified.contains(address);
  }

  @Override
  public boolean hasClaim(String address, long topicId) {
    Set<String> holders = claims.get(topicId);
    return holders != null && holders.contains(address);
  }
}
