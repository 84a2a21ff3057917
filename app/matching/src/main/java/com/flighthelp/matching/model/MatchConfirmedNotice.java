package com.flighthelp.matching.model;

import java.math.BigDecimal;
import java.time.Instant;

/** マッチ成立を requester/helper へ伝えるための通知内容。 */
public record MatchConfirmedNotice(
    ServiceDomain domain,
    long requestId,
    long offerId,
    String requesterId,
    String helperId,
    String itinerary,
    BigDecimal amount,
    Instant matchedAt) {}
