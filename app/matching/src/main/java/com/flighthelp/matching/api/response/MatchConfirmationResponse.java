package com.flighthelp.matching.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/** 確定/取消 API の出力。matched_at は ISO-8601 文字列。 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record MatchConfirmationResponse(
    String domain,
    long requestId,
    long offerId,
    String requesterId,
    String helperId,
    String matchedAt,
    String status) {}
