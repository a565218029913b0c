package com.inviteledger.reconciler.repository;

import static com.inviteledger.common.EpochSeconds.readInstant;
import static com.inviteledger.common.EpochSeconds.toEpochSeconds;

import com.inviteledger.reconciler.model.AdminActionKind;
import com.inviteledger.reconciler.model.AdminActionRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class AdminActionRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public void insert(AdminActionRecord record) {
    final String sql =
        """
        INSERT INTO admin_actions (
          id, actor_id, action, target_chat_id, target_remote_username, detail_json, performed_at
        ) VALUES (
          :id, :actorId, :action, :targetChatId, :targetRemoteUsername,
          CAST(:detailJson AS jsonb), :performedAt
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", record.id())
            .addValue("actorId", record.actorId())
            .addValue("action", record.kind().name())
            .addValue("targetChatId", record.targetChatId())
            .addValue("targetRemoteUsername", record.targetRemoteUsername())
            .addValue("detailJson", record.detailJson())
            .addValue("performedAt", toEpochSeconds(record.performedAt()));
    jdbcTemplate.update(sql, params);
  }

  public List<AdminActionRecord> findByTargetChatId(String chatId) {
    final String sql =
        """
        SELECT id, actor_id, action, target_chat_id, target_remote_username,
               detail_json::text AS detail_json_text, performed_at
        FROM admin_actions
        WHERE target_chat_id = :chatId
        ORDER BY performed_at DESC, id
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("chatId", chatId);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  private AdminActionRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new AdminActionRecord(
        rs.getObject("id", UUID.class),
        rs.getString("actor_id"),
        AdminActionKind.valueOf(rs.getString("action")),
        rs.getString("target_chat_id"),
        rs.getString("target_remote_username"),
        rs.getString("detail_json_text"),
        readInstant(rs, "performed_at"));
  }
}
