package com.inviteledger.common;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;

/** Converts between {@link Instant} and the nullable epoch-second columns used by the stores. */
public final class EpochSeconds {

  private EpochSeconds() {}

  public static Long toEpochSeconds(Instant instant) {
    return instant == null ? null : instant.getEpochSecond();
  }

  public static Instant toInstant(Long epochSeconds) {
    return epochSeconds == null ? null : Instant.ofEpochSecond(epochSeconds);
  }

  /** Reads a BIGINT column that may be SQL NULL. */
  public static Instant readInstant(ResultSet rs, String column) throws SQLException {
    return toInstant(rs.getObject(column, Long.class));
  }
}
