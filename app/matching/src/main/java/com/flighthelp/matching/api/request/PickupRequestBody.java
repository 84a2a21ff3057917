/*
 * どこで: Matching API リクエスト DTO
 * 何を: 送迎依頼の登録入力を定義する
 * なぜ: 到着日時と人数を受信時点で検証するため
 */
package com.flighthelp.matching.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalTime;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PickupRequestBody(
    String flightNumber,
    @NotNull LocalDate arrivalDate,
    @NotNull LocalTime arrivalTime,
    @NotBlank String airport,
    String destinationAddress,
    String passengerName,
    String passengerPhone,
    @NotNull @Min(1) Integer passengerCount,
    Boolean hasLuggage,
    @NotNull @DecimalMin("0.0") BigDecimal offeredAmount,
    String specialRequests) {}
