package com.inviteledger.reconciler.repository;

import static org.assertj.core.api.Assertions.assertThat;

import com.inviteledger.reconciler.AbstractPostgresContainerTest;
import com.inviteledger.reconciler.model.DirectoryEntry;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
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
class DirectoryCacheRepositoryTest extends AbstractPostgresContainerTest {

  private static final Instant FIRST_SYNC = Instant.parse("2026-03-01T00:00:00Z");
  private static final Instant SECOND_SYNC = FIRST_SYNC.plus(Duration.ofHours(12));

  @Autowired private DirectoryCacheRepository directoryCacheRepository;
  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  @BeforeEach
  void cleanup() {
    jdbcTemplate.update("DELETE FROM directory_entries", new MapSqlParameterSource());
  }

  @Test
  void replaceAllIsIdempotent() {
    final List<DirectoryEntry> entries =
        List.of(entry("r1", "alice", "100", FIRST_SYNC), entry("r2", "bob", null, FIRST_SYNC));

    directoryCacheRepository.replaceAll(entries, FIRST_SYNC);
    final List<Map<String, Object>> afterFirst = snapshot();
    directoryCacheRepository.replaceAll(entries, FIRST_SYNC);

    assertThat(snapshot()).isEqualTo(afterFirst);
    assertThat(directoryCacheRepository.count()).isEqualTo(2);
  }

  @Test
  void replaceAllLeavesUnobservedEntriesUntouched() {
    directoryCacheRepository.replaceAll(
        List.of(entry("r1", "alice", "100", FIRST_SYNC), entry("r2", "bob", null, FIRST_SYNC)),
        FIRST_SYNC);

    directoryCacheRepository.replaceAll(
        List.of(entry("r1", "alice-renamed", "100", SECOND_SYNC)), SECOND_SYNC);

    assertThat(directoryCacheRepository.findByRemoteUsername("bob"))
        .hasValueSatisfying(bob -> assertThat(bob.lastSyncedAt()).isEqualTo(FIRST_SYNC));
    assertThat(directoryCacheRepository.findByChatId("100"))
        .hasValueSatisfying(
            alice -> {
              assertThat(alice.remoteUsername()).isEqualTo("alice-renamed");
              assertThat(alice.lastSyncedAt()).isEqualTo(SECOND_SYNC);
            });
  }

  @Test
  void findByRemoteUsernameIsCaseSensitive() {
    directoryCacheRepository.replaceAll(List.of(entry("r1", "Alice", "100", FIRST_SYNC)), FIRST_SYNC);

    assertThat(directoryCacheRepository.findByRemoteUsername("Alice")).isPresent();
    assertThat(directoryCacheRepository.findByRemoteUsername("alice")).isEmpty();
  }

  @Test
  void duplicateNamesResolveToMostRecentlySyncedEntry() {
    directoryCacheRepository.replaceAll(List.of(entry("r1", "alice", "100", FIRST_SYNC)), FIRST_SYNC);
    directoryCacheRepository.replaceAll(List.of(entry("r9", "alice", "900", SECOND_SYNC)), SECOND_SYNC);

    assertThat(directoryCacheRepository.findByRemoteUsername("alice"))
        .hasValueSatisfying(entry -> assertThat(entry.remoteUserId()).isEqualTo("r9"));
  }

  @Test
  void emptyReplaceWritesNothing() {
    assertThat(directoryCacheRepository.replaceAll(List.of(), FIRST_SYNC)).isZero();
    assertThat(directoryCacheRepository.count()).isZero();
  }

  private List<Map<String, Object>> snapshot() {
    return jdbcTemplate.queryForList(
        "SELECT * FROM directory_entries ORDER BY remote_user_id", new MapSqlParameterSource());
  }

  private static DirectoryEntry entry(String id, String name, String chatId, Instant syncedAt) {
    return new DirectoryEntry(
        id, name, chatId, name + "@example.test", FIRST_SYNC.plus(Duration.ofDays(30)), false, false, syncedAt);
  }
}
