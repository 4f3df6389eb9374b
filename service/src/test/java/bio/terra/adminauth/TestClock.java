package bio.terra.adminauth;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

/** A clock that only moves when a test moves it. */
public class TestClock extends Clock {
  private volatile Instant instant;

  public TestClock(Instant instant) {
    this.instant = instant;
  }

  public static TestClock atEpochSecond(long epochSecond) {
    return new TestClock(Instant.ofEpochSecond(epochSecond));
  }

  public void setInstant(Instant instant) {
    this.instant = instant;
  }

  public void advance(Duration duration) {
    this.instant = instant.plus(duration);
  }

  public long epochSecond() {
    return instant.getEpochSecond();
  }

  @Override
  public ZoneId getZone() {
    return ZoneOffset.UTC;
  }

  @Override
  public Clock withZone(ZoneId zone) {
    return this;
  }

  @Override
  public Instant instant() {
    return instant;
  }
}
