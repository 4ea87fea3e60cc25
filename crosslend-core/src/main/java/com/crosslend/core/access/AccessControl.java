package com.crosslend.core.access;

import com.crosslend.core.domain.Assets;
import com.crosslend.core.domain.Role;
import com.crosslend.core.error.ErrorCode;
import com.crosslend.core.error.LendingException;
import lombok.extern.slf4j.Slf4j;

import java.util.EnumMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Explicit role table. There is no ambient authority: every privileged entry point names the role it
 * needs and the caller it acts for.
 */
@Slf4j
public class AccessControl {

  private final Map<Role, Set<String>> members = new EnumMap<>(Role.class);

  public AccessControl(String owner) {
    for (Role role : Role.values()) {
      members.put(role, ConcurrentHashMap.newKeySet());
    }
    members.get(Role.OWNER).add(Assets.normalize(owner));
  }

  public boolean hasRole(String account, Role role) {
    return account != null && members.get(role).contains(account);
  }

  public void requireRole(String account, Role role) {
    if (!hasRole(account, role)) {
      throw new LendingException(ErrorCode.UNAUTHORIZED, account + " lacks role " + role);
    }
  }

  public void grant(String caller, Role role, String account) {
    requireRole(caller, Role.OWNER);
    String normalized = Assets.normalize(account);
    if (members.get(role).add(normalized)) {
      log.info("role granted role={} account={} by={}", role, normalized, caller);
    }
  }

  public void revoke(String caller, Role role, String account) {
    requireRole(caller, Role.OWNER);
    String normalized = Assets.normalize(account);
    if (role == Role.OWNER && members.get(Role.OWNER).size() == 1 && members.get(Role.OWNER).contains(normalized)) {
      throw new LendingException(ErrorCode.INVALID_STATE, "cannot revoke the last owner");
    }
    if (members.get(role).remove(normalized)) {
      log.info("role revoked role={} account={} by={}", role, normalized, caller);
    }
  }

  /**
   * Seeds a role during wiring, before any caller exists.
   */
  public void bootstrap(Role role, String account) {
    members.get(role).add(Assets.normalize(account));
  }

  public Set<String> membersOf(Role role) {
    return Set.copyOf(members.get(role));
  }
}
