/*
 * どこで: 共通イベント定義
 * 何を: マッチ成立通知の payload を表現する
 * なぜ: 通知の送信側と受信側で同じ JSON 形状を共有するため
 */
package com.flighthelp.common.event;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record MatchConfirmedEventPayload(
    String eventId,
    String eventType,
    String occurredAt,
    String domain,
    long requestId,
    long offerId,
    String requesterId,
    String helperId,
    String itinerary,
    String amount,
    String traceId) {}
