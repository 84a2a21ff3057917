package com.flighthelp.matching.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.math.BigDecimal;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PostedOfferResponse(
    String domain,
    long offerId,
    String helperId,
    String itinerary,
    BigDecimal price,
    String status,
    String createdAt) {}
