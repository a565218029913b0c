/*
 * Where: reconciler data access
 * What: reads and writes invite_records, one statement per operation
 * Why: the coordinator and the expiry pass share this single source of lifecycle state
 */
package com.inviteledger.reconciler.repository;

import static com.inviteledger.common.EpochSeconds.readInstant;
import static com.inviteledger.common.EpochSeconds.toEpochSeconds;

import com.inviteledger.reconciler.model.InviteRecord;
import com.inviteledger.reconciler.model.InviteStatus;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class InviteRepository {

  private static final String SELECT_FROM =
      """
      SELECT chat_id, chat_username, invite_code, remote_user_id, plan,
             account_expires_at, invite_expires_at, last_notified_at, status, created_at, updated_at
      FROM invite_records
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  /**
   * Inserts or merges by chat id. A changed plan or account expiry resets the status to the
   * plan-derived value and clears the notification marker; created_at survives the merge.
   */
  public InviteRecord upsert(InviteRecord record) {
    final String sql =
        """
        INSERT INTO invite_records (
          chat_id, chat_username, invite_code, remote_user_id, plan,
          account_expires_at, invite_expires_at, last_notified_at, status, created_at, updated_at
        ) VALUES (
          :chatId, :chatUsername, :inviteCode, :remoteUserId, :plan,
          :accountExpiresAt, :inviteExpiresAt, :lastNotifiedAt, :status, :createdAt, :now
        )
        ON CONFLICT (chat_id) DO UPDATE SET
          status = CASE
            WHEN invite_records.plan IS DISTINCT FROM EXCLUDED.plan
              OR invite_records.account_expires_at IS DISTINCT FROM EXCLUDED.account_expires_at
            THEN :derivedStatus
            ELSE EXCLUDED.status
          END,
          last_notified_at = CASE
            WHEN invite_records.plan IS DISTINCT FROM EXCLUDED.plan
              OR invite_records.account_expires_at IS DISTINCT FROM EXCLUDED.account_expires_at
            THEN NULL
            ELSE EXCLUDED.last_notified_at
          END,
          chat_username = EXCLUDED.chat_username,
          invite_code = EXCLUDED.invite_code,
          remote_user_id = EXCLUDED.remote_user_id,
          plan = EXCLUDED.plan,
          account_expires_at = EXCLUDED.account_expires_at,
          invite_expires_at = EXCLUDED.invite_expires_at,
          updated_at = EXCLUDED.updated_at
        RETURNING chat_id, chat_username, invite_code, remote_user_id, plan,
          account_expires_at, invite_expires_at, last_notified_at, status, created_at, updated_at
        """;
    final Instant now = record.updatedAt() != null ? record.updatedAt() : record.createdAt();
    final Instant createdAt = record.createdAt() != null ? record.createdAt() : now;
    final InviteStatus status =
        record.status() != null ? record.status() : InviteStatus.forPlan(record.plan());
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("chatId", record.chatId())
            .addValue("chatUsername", record.chatUsername())
            .addValue("inviteCode", record.inviteCode())
            .addValue("remoteUserId", record.remoteUserId())
            .addValue("plan", record.plan())
            .addValue("accountExpiresAt", toEpochSeconds(record.accountExpiresAt()))
            .addValue("inviteExpiresAt", toEpochSeconds(record.inviteExpiresAt()))
            .addValue("lastNotifiedAt", toEpochSeconds(record.lastNotifiedAt()))
            .addValue("status", status.value())
            .addValue("derivedStatus", InviteStatus.forPlan(record.plan()).value())
            .addValue("createdAt", toEpochSeconds(createdAt))
            .addValue("now", toEpochSeconds(now));
    return jdbcTemplate.queryForObject(sql, params, this::mapRow);
  }

  public Optional<InviteRecord> get(String chatId) {
    final String sql = SELECT_FROM + "WHERE chat_id = :chatId";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("chatId", chatId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  /** Case-insensitive exact match on the stored chat display label. */
  public List<InviteRecord> findByDisplayName(String name) {
    final String sql =
        SELECT_FROM
            + """
            WHERE LOWER(chat_username) = LOWER(:name)
            ORDER BY updated_at DESC, chat_id
            """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("name", name);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  /**
   * Case-insensitive pattern match. {@code *} is a wildcard; a pattern without one matches as a
   * substring. Prefix matches come first.
   */
  public List<InviteRecord> findByDisplayNamePattern(String pattern) {
    final String sql =
        SELECT_FROM
            + """
            WHERE chat_username ILIKE :pattern
            ORDER BY CASE WHEN chat_username ILIKE :prefix THEN 0 ELSE 1 END,
                     LOWER(chat_username), chat_id
            """;
    final String escaped = escapeLike(pattern);
    final String likePattern =
        escaped.contains("*") ? escaped.replace('*', '%') : "%" + escaped + "%";
    final int wildcard = escaped.indexOf('*');
    final String prefix = (wildcard < 0 ? escaped : escaped.substring(0, wildcard)) + "%";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("pattern", likePattern).addValue("prefix", prefix);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  /** Never deletes; returns the number of rows changed. */
  public int setStatus(String chatId, InviteStatus status, Instant now) {
    final String sql =
        """
        UPDATE invite_records
        SET status = :status, updated_at = :now
        WHERE chat_id = :chatId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("chatId", chatId)
            .addValue("status", status.value())
            .addValue("now", toEpochSeconds(now));
    return jdbcTemplate.update(sql, params);
  }

  public int setLastNotified(String chatId, Instant notifiedAt) {
    final String sql =
        """
        UPDATE invite_records
        SET last_notified_at = :notifiedAt
        WHERE chat_id = :chatId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("chatId", chatId)
            .addValue("notifiedAt", toEpochSeconds(notifiedAt));
    return jdbcTemplate.update(sql, params);
  }

  /** Marks an unclaimed record as claimed by the given remote account. */
  public int linkRemoteAccount(String chatId, String remoteUserId, Instant now) {
    final String sql =
        """
        UPDATE invite_records
        SET remote_user_id = :remoteUserId, updated_at = :now
        WHERE chat_id = :chatId
          AND remote_user_id IS NULL
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("chatId", chatId)
            .addValue("remoteUserId", remoteUserId)
            .addValue("now", toEpochSeconds(now));
    return jdbcTemplate.update(sql, params);
  }

  public List<InviteRecord> listExpiringBefore(Instant threshold) {
    final String sql =
        SELECT_FROM
            + """
            WHERE account_expires_at IS NOT NULL
              AND account_expires_at <= :threshold
              AND status <> 'disabled'
            ORDER BY account_expires_at, chat_id
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("threshold", toEpochSeconds(threshold));
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  private static String escapeLike(String value) {
    return value.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
  }

  private InviteRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new InviteRecord(
        rs.getString("chat_id"),
        rs.getString("chat_username"),
        rs.getString("invite_code"),
        rs.getString("remote_user_id"),
        rs.getString("plan"),
        readInstant(rs, "account_expires_at"),
        readInstant(rs, "invite_expires_at"),
        readInstant(rs, "last_notified_at"),
        InviteStatus.fromValue(rs.getString("status")),
        readInstant(rs, "created_at"),
        readInstant(rs, "updated_at"));
  }
}
