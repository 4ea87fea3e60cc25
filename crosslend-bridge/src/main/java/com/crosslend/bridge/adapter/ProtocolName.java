package com.crosslend.bridge.adapter;

import com.crosslend.core.error.ErrorCode;
import com.crosslend.core.error.LendingException;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Registered protocol names are immutable keys. Upgrades register a new versioned name
 * ({@code ccip-v2}) and move chain preferences over to it.
 */
public final class ProtocolName {

  private static final Pattern NAME = Pattern.compile("^[a-z][a-z0-9]*(?:-[a-z0-9]+)*$");
  private static final Pattern VERSION_SUFFIX = Pattern.compile("^(.+)-v(\\d+)$");

  private ProtocolName() {
  }

  public static String validate(String name) {
    if (name == null || !NAME.matcher(name).matches()) {
      throw new LendingException(ErrorCode.INVALID_PROTOCOL_NAME, "protocol name must be lower-case kebab: " + name);
    }
    return name;
  }

  public static String baseOf(String name) {
    Matcher m = VERSION_SUFFIX.matcher(name);
    return m.matches() ? m.group(1) : name;
  }

  public static int versionOf(String name) {
    Matcher m = VERSION_SUFFIX.matcher(name);
    return m.matches() ? Integer.parseInt(m.group(2)) : 1;
  }

  public static String versioned(String base, int version) {
    return version <= 1 ? base : base + "-v" + version;
  }
}
