package com.flighthelp.matching.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.math.BigDecimal;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PostedRequestResponse(
    String domain,
    long requestId,
    String requesterId,
    String itinerary,
    BigDecimal offeredAmount,
    String status,
    String createdAt) {}
