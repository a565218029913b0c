/*
 * Where: reconciler data access
 * What: upserts and looks up the mirrored provisioning directory
 * Why: the resolver needs remote identities without calling the provisioning service
 */
package com.inviteledger.reconciler.repository;

import static com.inviteledger.common.EpochSeconds.readInstant;
import static com.inviteledger.common.EpochSeconds.toEpochSeconds;

import com.inviteledger.reconciler.model.DirectoryEntry;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Collection;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

@Repository
@RequiredArgsConstructor
public class DirectoryCacheRepository {

  private static final String SELECT_FROM =
      """
      SELECT remote_user_id, remote_username, linked_chat_id, email, expires_at,
             disabled_flag, is_admin_flag, last_synced_at
      FROM directory_entries
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  /**
   * Upserts every entry with the same sync timestamp in one transaction. Entries not present in
   * {@code entries} are left as they are.
   *
   * @return number of entries written
   */
  @Transactional
  public int replaceAll(Collection<DirectoryEntry> entries, Instant syncedAt) {
    if (entries.isEmpty()) {
      return 0;
    }
    final String sql =
        """
        INSERT INTO directory_entries (
          remote_user_id, remote_username, linked_chat_id, email, expires_at,
          disabled_flag, is_admin_flag, last_synced_at
        ) VALUES (
          :remoteUserId, :remoteUsername, :linkedChatId, :email, :expiresAt,
          :disabled, :admin, :syncedAt
        )
        ON CONFLICT (remote_user_id) DO UPDATE SET
          remote_username = EXCLUDED.remote_username,
          linked_chat_id = EXCLUDED.linked_chat_id,
          email = EXCLUDED.email,
          expires_at = EXCLUDED.expires_at,
          disabled_flag = EXCLUDED.disabled_flag,
          is_admin_flag = EXCLUDED.is_admin_flag,
          last_synced_at = EXCLUDED.last_synced_at
        """;
    final SqlParameterSource[] batch =
        entries.stream()
            .map(
                entry ->
                    new MapSqlParameterSource()
                        .addValue("remoteUserId", entry.remoteUserId())
                        .addValue("remoteUsername", entry.remoteUsername())
                        .addValue("linkedChatId", entry.linkedChatId())
                        .addValue("email", entry.email())
                        .addValue("expiresAt", toEpochSeconds(entry.expiresAt()))
                        .addValue("disabled", entry.disabled())
                        .addValue("admin", entry.admin())
                        .addValue("syncedAt", toEpochSeconds(syncedAt)))
            .toArray(SqlParameterSource[]::new);
    jdbcTemplate.batchUpdate(sql, batch);
    return batch.length;
  }

  /** Exact, case-sensitive. The most recently synced row wins if names collide. */
  public Optional<DirectoryEntry> findByRemoteUsername(String remoteUsername) {
    final String sql =
        SELECT_FROM
            + """
            WHERE remote_username = :remoteUsername
            ORDER BY last_synced_at DESC, remote_user_id
            LIMIT 1
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("remoteUsername", remoteUsername);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public Optional<DirectoryEntry> findByChatId(String chatId) {
    final String sql =
        SELECT_FROM
            + """
            WHERE linked_chat_id = :chatId
            ORDER BY last_synced_at DESC, remote_user_id
            LIMIT 1
            """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("chatId", chatId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public long count() {
    final Long count =
        jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM directory_entries", new MapSqlParameterSource(), Long.class);
    return count == null ? 0L : count;
  }

  private DirectoryEntry mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new DirectoryEntry(
        rs.getString("remote_user_id"),
        rs.getString("remote_username"),
        rs.getString("linked_chat_id"),
        rs.getString("email"),
        readInstant(rs, "expires_at"),
        rs.getBoolean("disabled_flag"),
        rs.getBoolean("is_admin_flag"),
        readInstant(rs, "last_synced_at"));
  }
}
