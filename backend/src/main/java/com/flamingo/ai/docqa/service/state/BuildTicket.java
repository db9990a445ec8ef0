package com.flamingo.ai.docqa.service.state;

import java.time.Duration;
import java.time.Instant;

/**
 * Handed out when an index build starts; presented again when the build publishes.
 *
 * @param sequence strictly increasing issue number
 * @param issuedAt when the build started
 */
public record BuildTicket(long sequence, Instant issuedAt) {

  public boolean isOlderThan(long otherSequence) {
    return sequence < otherSequence;
  }

  /** Time since the build started, never negative. */
  public Duration elapsed(Instant now) {
    Duration elapsed = Duration.between(issuedAt, now);
    return elapsed.isNegative() ? Duration.ZERO : elapsed;
  }
}
