package com.crosslend.core.compliance;

/**
 * Identity/claim authority. Only queried; issuance lives elsewhere.
 */
public interface ComplianceGate {

  boolean isVerified(String address);

  boolean hasClaim(String address, long topicId);
}
