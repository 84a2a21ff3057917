/*
 * どこで: Matching データアクセス
 * 何を: match_audit の登録/参照を行う
 * なぜ: マッチ確定と取消の操作履歴を追跡できるようにするため
 */
package com.flighthelp.matching.repository;

import static com.flighthelp.common.JdbcTimestampUtils.toTimestamp;

import com.flighthelp.matching.model.MatchAuditRecord;
import com.flighthelp.matching.model.ServiceDomain;
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
public class MatchAuditRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public int insert(MatchAuditRecord record) {
    final String sql =
        """
        INSERT INTO match_audit (
          audit_id,
          domain,
          request_id,
          offer_id,
          action,
          actor_id,
          occurred_at
        ) VALUES (
          :auditId,
          :domain,
          :requestId,
          :offerId,
          :action,
          :actorId,
          :occurredAt
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("auditId", record.auditId())
            .addValue("domain", record.domain().value())
            .addValue("requestId", record.requestId())
            .addValue("offerId", record.offerId())
            .addValue("action", record.action())
            .addValue("actorId", record.actorId())
            .addValue("occurredAt", toTimestamp(record.occurredAt()));
    return jdbcTemplate.update(sql, params);
  }

  public List<MatchAuditRecord> findByRequest(ServiceDomain domain, long requestId) {
    final String sql =
        """
        SELECT audit_id, domain, request_id, offer_id, action, actor_id, occurred_at
        FROM match_audit
        WHERE domain = :domain AND request_id = :requestId
        ORDER BY occurred_at, audit_id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("domain", domain.value())
            .addValue("requestId", requestId);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  private MatchAuditRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new MatchAuditRecord(
        rs.getObject("audit_id", UUID.class),
        ServiceDomain.fromValue(rs.getString("domain")),
        rs.getLong("request_id"),
        rs.getLong("offer_id"),
        rs.getString("action"),
        rs.getString("actor_id"),
        rs.getTimestamp("occurred_at").toInstant());
  }
}
