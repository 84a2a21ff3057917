/*
 * どこで: Matching API リクエスト DTO
 * 何を: マッチ確定 API の入力を定義する
 * なぜ: 受信 JSON を型安全に取り扱うため
 */
package com.flighthelp.matching.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotNull;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ConfirmMatchRequest(@NotNull Long requestId, @NotNull Long offerId) {}
