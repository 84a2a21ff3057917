/*
 * どこで: Matching ドメインモデル
 * 何を: match_audit の 1 行を表現する
 * なぜ: 確定/取消の履歴を追跡できるようにするため
 */
package com.flighthelp.matching.model;

import java.time.Instant;
import java.util.UUID;

public record MatchAuditRecord(
    UUID auditId,
    ServiceDomain domain,
    long requestId,
    long offerId,
    String action,
    String actorId,
    Instant occurredAt) {

  public static final String ACTION_CONFIRMED = "CONFIRMED";
  public static final String ACTION_CANCELLED = "CANCELLED";
}
