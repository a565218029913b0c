package com.inviteledger.reconciler.repository;

import static org.assertj.core.api.Assertions.assertThat;

import com.inviteledger.reconciler.AbstractPostgresContainerTest;
import com.inviteledger.reconciler.model.InviteRecord;
import com.inviteledger.reconciler.model.InviteStatus;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.testcontainers.junit.jupiter.Testcontainers;

@SpringBootTest
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
class InviteRepositoryTest extends AbstractPostgresContainerTest {

  private static final Instant BASE_TIME = Instant.parse("2026-03-01T00:00:00Z");

  @Autowired private InviteRepository inviteRepository;
  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  @BeforeEach
  void cleanup() {
    jdbcTemplate.update("DELETE FROM invite_records", new MapSqlParameterSource());
  }

  @Test
  void upsertThenGetReturnsEveryField() {
    final InviteRecord record =
        new InviteRecord(
            "100",
            "alice",
            "CODE-1",
            "remote-1",
            "premium",
            BASE_TIME.plus(Duration.ofDays(30)),
            BASE_TIME.plus(Duration.ofDays(1)),
            BASE_TIME.minus(Duration.ofHours(2)),
            InviteStatus.PAID,
            BASE_TIME,
            BASE_TIME.plus(Duration.ofHours(1)));

    final InviteRecord returned = inviteRepository.upsert(record);

    assertThat(returned).isEqualTo(record);
    assertThat(inviteRepository.get("100")).contains(record);
  }

  @Test
  void upsertWithChangedPlanResetsStatusAndClearsNotificationMarker() {
    inviteRepository.upsert(trial("100", "alice", BASE_TIME.plus(Duration.ofDays(3)), BASE_TIME));
    inviteRepository.setLastNotified("100", BASE_TIME.plus(Duration.ofHours(1)));
    inviteRepository.setStatus("100", InviteStatus.DISABLED, BASE_TIME.plus(Duration.ofHours(2)));

    final Instant later = BASE_TIME.plus(Duration.ofDays(1));
    final InviteRecord merged =
        inviteRepository.upsert(
            new InviteRecord(
                "100",
                "alice",
                "CODE-2",
                null,
                "premium",
                later.plus(Duration.ofDays(30)),
                later.plus(Duration.ofDays(1)),
                BASE_TIME.plus(Duration.ofHours(1)),
                InviteStatus.DISABLED,
                later,
                later));

    assertThat(merged.status()).isEqualTo(InviteStatus.PAID);
    assertThat(merged.lastNotifiedAt()).isNull();
    assertThat(merged.createdAt()).isEqualTo(BASE_TIME);
    assertThat(merged.updatedAt()).isEqualTo(later);
    assertThat(merged.inviteCode()).isEqualTo("CODE-2");
  }

  @Test
  void upsertWithSamePlanAndExpiryKeepsSuppliedStatusAndMarker() {
    final Instant expiry = BASE_TIME.plus(Duration.ofDays(3));
    inviteRepository.upsert(trial("100", "alice", expiry, BASE_TIME));

    final InviteRecord merged =
        inviteRepository.upsert(
            new InviteRecord(
                "100", "alice-renamed", "CODE-1", "remote-1", "trial", expiry, null,
                BASE_TIME.plus(Duration.ofHours(5)), InviteStatus.TRIAL, BASE_TIME,
                BASE_TIME.plus(Duration.ofHours(6))));

    assertThat(merged.chatUsername()).isEqualTo("alice-renamed");
    assertThat(merged.lastNotifiedAt()).isEqualTo(BASE_TIME.plus(Duration.ofHours(5)));
    assertThat(merged.status()).isEqualTo(InviteStatus.TRIAL);
  }

  @Test
  void setStatusDisabledKeepsTheRow() {
    inviteRepository.upsert(trial("100", "alice", BASE_TIME.plus(Duration.ofDays(3)), BASE_TIME));

    final int updated = inviteRepository.setStatus("100", InviteStatus.DISABLED, BASE_TIME);

    assertThat(updated).isEqualTo(1);
    assertThat(inviteRepository.get("100"))
        .hasValueSatisfying(record -> assertThat(record.status()).isEqualTo(InviteStatus.DISABLED));
    assertThat(inviteRepository.setStatus("missing", InviteStatus.DISABLED, BASE_TIME)).isZero();
  }

  @Test
  void findByDisplayNameIsCaseInsensitiveAndExact() {
    inviteRepository.upsert(trial("100", "Alice", null, BASE_TIME));
    inviteRepository.upsert(trial("200", "alice2", null, BASE_TIME));

    assertThat(inviteRepository.findByDisplayName("ALICE"))
        .extracting(InviteRecord::chatId)
        .containsExactly("100");
  }

  @Test
  void findByDisplayNamePatternSupportsWildcardAndSubstringWithPrefixFirst() {
    inviteRepository.upsert(trial("100", "malice", null, BASE_TIME));
    inviteRepository.upsert(trial("200", "Alice", null, BASE_TIME));
    inviteRepository.upsert(trial("300", "bob", null, BASE_TIME));
    inviteRepository.upsert(trial("400", "al_ex", null, BASE_TIME));

    assertThat(inviteRepository.findByDisplayNamePattern("lic"))
        .extracting(InviteRecord::chatId)
        .containsExactly("200", "100");
    assertThat(inviteRepository.findByDisplayNamePattern("ali"))
        .extracting(InviteRecord::chatId)
        .containsExactly("200", "100");
    assertThat(inviteRepository.findByDisplayNamePattern("a*e"))
        .extracting(InviteRecord::chatId)
        .containsExactly("200");
    // underscore is literal, not a single-character wildcard
    assertThat(inviteRepository.findByDisplayNamePattern("l_e"))
        .extracting(InviteRecord::chatId)
        .containsExactly("400");
    assertThat(inviteRepository.findByDisplayNamePattern("zzz")).isEmpty();
  }

  @Test
  void listExpiringBeforeSkipsDisabledAndNonExpiringRecords() {
    inviteRepository.upsert(trial("100", "a", BASE_TIME.plus(Duration.ofDays(2)), BASE_TIME));
    inviteRepository.upsert(trial("200", "b", BASE_TIME.plus(Duration.ofDays(1)), BASE_TIME));
    inviteRepository.upsert(trial("300", "c", BASE_TIME.plus(Duration.ofDays(9)), BASE_TIME));
    inviteRepository.upsert(trial("400", "d", null, BASE_TIME));
    inviteRepository.upsert(trial("500", "e", BASE_TIME.plus(Duration.ofDays(1)), BASE_TIME));
    inviteRepository.setStatus("500", InviteStatus.DISABLED, BASE_TIME);

    final List<InviteRecord> expiring =
        inviteRepository.listExpiringBefore(BASE_TIME.plus(Duration.ofDays(4)));

    assertThat(expiring).extracting(InviteRecord::chatId).containsExactly("200", "100");
  }

  @Test
  void linkRemoteAccountOnlyClaimsUnlinkedRecords() {
    inviteRepository.upsert(trial("100", "alice", null, BASE_TIME));

    assertThat(inviteRepository.linkRemoteAccount("100", "remote-1", BASE_TIME)).isEqualTo(1);
    assertThat(inviteRepository.linkRemoteAccount("100", "remote-2", BASE_TIME)).isZero();
    assertThat(inviteRepository.get("100"))
        .hasValueSatisfying(record -> assertThat(record.remoteUserId()).isEqualTo("remote-1"));
  }

  private static InviteRecord trial(String chatId, String name, Instant expiresAt, Instant now) {
    return new InviteRecord(
        chatId, name, "CODE-" + chatId, null, "trial", expiresAt, null, null, InviteStatus.TRIAL, now, now);
  }
}
