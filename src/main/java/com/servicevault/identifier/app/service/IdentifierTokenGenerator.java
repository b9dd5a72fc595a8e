package com.servicevault.identifier.app.service;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.Objects;

/**
 * Produces public tokens of the form {@code PREFIX-<epochMillis>-<9 base36 chars>}. Uniqueness is
 * enforced on insert by the repository; the random part only makes collisions unlikely.
 */
public class IdentifierTokenGenerator {

  private static final char[] BASE36 = "0123456789abcdefghijklmnopqrstuvwxyz".toCharArray();
  private static final int RANDOM_LENGTH = 9;

  private final String prefix;
  private final Clock clock;
  private final SecureRandom random;

  public IdentifierTokenGenerator(String prefix, Clock clock) {
    this(prefix, clock, new SecureRandom());
  }

  public IdentifierTokenGenerator(String prefix, Clock clock, SecureRandom random) {
    this.prefix = Objects.requireNonNull(prefix, "prefix");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.random = Objects.requireNonNull(random, "random");
  }

  public String next() {
    StringBuilder sb = new StringBuilder(prefix.length() + 32);
    sb.append(prefix).append('-').append(clock.millis()).append('-');
    for (int i = 0; i < RANDOM_LENGTH; i++) {
      sb.append(BASE36[random.nextInt(BASE36.length)]);
    }
    return sb.toString();
  }
}
