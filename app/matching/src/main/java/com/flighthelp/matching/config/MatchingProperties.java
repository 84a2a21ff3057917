/*
 * どこで: Matching 設定
 * 何を: 検索上限・許容幅・スコア重みのドメイン設定を保持する
 * なぜ: 根拠の薄い重み/閾値をコードに埋め込まず、環境ごとに調整できるようにするため
 */
package com.flighthelp.matching.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "matching")
public record MatchingProperties(
    @Positive int maxResultsLimit,
    @NotNull Duration pickupTimeTolerance,
    @DecimalMin("0.0") double priceTolerance,
    @Valid @NotNull Scoring scoring) {

  /** 重みは合計 1 である必要はない。スコアは適用された重みの合計で正規化する。 */
  public record Scoring(
      @DecimalMin("0.0") double priceWeight,
      @DecimalMin("0.0") double reputationWeight,
      @DecimalMin("0.0") double capabilityWeight,
      @DecimalMin("0.0") @DecimalMax("1.0") double neutralReputation,
      @Positive int experienceCap) {}
}
