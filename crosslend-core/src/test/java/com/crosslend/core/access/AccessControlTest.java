package com.crosslend.core.access;

import com.crosslend.core.domain.Role;
import com.crosslend.core.error.ErrorCode;
import com.crosslend.core.error.LendingException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AccessControlTest {

  private static final String OWNER = "0x00000000000000000000000000000000000000a1";
  private static final String RELAYER = "0x00000000000000000000000000000000000000f1";

  private final AccessControl access = new AccessControl(OWNER);

  @Test
  void ownerGrantsAndRevokesRoles() {
    access.grant(OWNER, Role.COMPLETION_CALLER, RELAYER);
    assertThat(access.hasRole(RELAYER, Role.COMPLETION_CALLER)).isTrue();

    access.revoke(OWNER, Role.COMPLETION_CALLER, RELAYER);
    assertThat(access.hasRole(RELAYER, Role.COMPLETION_CALLER)).isFalse();
  }

  @Test
  void nonOwnerCannotGrant() {
    assertThatThrownBy(() -> access.grant(RELAYER, Role.OWNER, RELAYER))
        .isInstanceOf(LendingException.class)
        .satisfies(e -> assertThat(((LendingException) e).code()).isEqualTo(ErrorCode.UNAUTHORIZED));
  }

  @Test
  void lastOwnerCannotBeRevoked() {
    assertThatThrownBy(() -> access.revoke(OWNER, Role.OWNER, OWNER))
        .isInstanceOf(LendingException.class)
        .satisfies(e -> assertThat(((LendingException) e).code()).isEqualTo(ErrorCode.INVALID_STATE));
  }
}
