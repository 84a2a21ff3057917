/*
 * どこで: Matching API リクエスト DTO
 * 何を: 送迎の申し出の登録入力を定義する
 * なぜ: 空港/日時/座席数を受信時点で検証するため
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
public record PickupOfferBody(
    @NotBlank String airport,
    @NotNull LocalDate availableDate,
    @NotNull LocalTime availableTime,
    String vehicleType,
    @Min(1) Integer maxPassengers,
    Boolean canHandleLuggage,
    String serviceArea,
    @NotNull @DecimalMin("0.0") BigDecimal baseRate,
    String languages,
    String additionalServices) {}
