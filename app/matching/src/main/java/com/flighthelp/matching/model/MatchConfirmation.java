/*
 * どこで: Matching ドメインモデル
 * 何を: 1 回のマッチ確定結果を表現する
 * なぜ: 確定処理から API 応答/通知へ必要最小限の情報を渡すため
 */
package com.flighthelp.matching.model;

import java.time.Instant;

public record MatchConfirmation(
    ServiceDomain domain,
    long requestId,
    long offerId,
    String requesterId,
    String helperId,
    Instant matchedAt) {}
