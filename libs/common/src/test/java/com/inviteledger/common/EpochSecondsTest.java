package com.inviteledger.common;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class EpochSecondsTest {

  @Test
  void nullStaysNullInBothDirections() {
    assertThat(EpochSeconds.toEpochSeconds(null)).isNull();
    assertThat(EpochSeconds.toInstant(null)).isNull();
  }

  @Test
  void dropsSubSecondPrecision() {
    final Instant instant = Instant.parse("2026-03-01T10:15:30.750Z");

    assertThat(EpochSeconds.toInstant(EpochSeconds.toEpochSeconds(instant)))
        .isEqualTo(Instant.parse("2026-03-01T10:15:30Z"));
  }

  @Test
  void readInstantHonoursSqlNull() throws SQLException {
    final ResultSet rs = mock(ResultSet.class);
    when(rs.getObject("expires_at", Long.class)).thenReturn(null);

    assertThat(EpochSeconds.readInstant(rs, "expires_at")).isNull();
  }

  @Test
  void readInstantConvertsValue() throws SQLException {
    final ResultSet rs = mock(ResultSet.class);
    when(rs.getObject("expires_at", Long.class)).thenReturn(1_767_225_600L);

    assertThat(EpochSeconds.readInstant(rs, "expires_at"))
        .isEqualTo(Instant.parse("2026-01-01T00:00:00Z"));
  }
}
