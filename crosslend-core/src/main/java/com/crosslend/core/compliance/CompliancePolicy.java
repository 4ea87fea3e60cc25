package com.crosslend.core.compliance;

import com.crosslend.core.config.LendingProperties;
import com.crosslend.core.error.ErrorCode;
import com.crosslend.core.error.LendingException;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;

/**
 * Applies the active {@link ComplianceMode} to a caller. Only deposits and borrows go through here;
 * repay and withdraw stay open so users can always exit.
 */
@RequiredArgsConstructor
public class CompliancePolicy {

  private final @NonNull ComplianceGate gate;
  private final @NonNull LendingProperties.Compliance settings;

  public ComplianceMode mode() {
    return settings.mode();
  }

  public boolean permits(String address) {
    if (settings.mode() == ComplianceMode.PERMISSIVE) {
      return true;
    }
    if (!gate.isVerified(address)) {
      return false;
    }
    Long topic = settings.claimTopic();
    return topic == null || gate.hasClaim(address, topic);
  }

  public void require(String address, String operation) {
    if (!permits(address)) {
      throw new LendingException(ErrorCode.COMPLIANCE_REQUIRED, operation + " rejected for " + address);
    }
  }
}
