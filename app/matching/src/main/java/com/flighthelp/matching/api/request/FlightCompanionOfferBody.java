/*
 * どこで: Matching API リクエスト DTO
 * 何を: 同行の申し出の登録入力を定義する
 * なぜ: 旅程キーの必須項目を受信時点で検証するため
 */
package com.flighthelp.matching.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import java.time.LocalDate;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record FlightCompanionOfferBody(
    @NotBlank String flightNumber,
    String airline,
    @NotNull LocalDate flightDate,
    @NotBlank String departureAirport,
    @NotBlank String arrivalAirport,
    String availableServices,
    String languages,
    @NotNull @DecimalMin("0.0") BigDecimal requestedAmount,
    String additionalInfo) {}
