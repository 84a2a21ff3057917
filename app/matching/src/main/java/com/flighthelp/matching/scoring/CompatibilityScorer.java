/*
 * どこで: Matching スコアリング層
 * 何を: request と offer の組み合わせを 0.0 - 1.0 の適合スコアへ変換する
 * なぜ: 価格・評判・能力の 3 要素を設定可能な重みで 1 つの順位へまとめるため
 */
package com.flighthelp.matching.scoring;

import com.flighthelp.matching.config.MatchingProperties;
import com.flighthelp.matching.model.HelpOffer;
import com.flighthelp.matching.model.HelpRequest;
import com.flighthelp.matching.model.ScoredOffer;
import com.google.common.annotations.VisibleForTesting;
import java.math.BigDecimal;
import java.util.Comparator;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class CompatibilityScorer {

  private static final double MAX_RATING = 5.0;
  private static final double RATING_SHARE = 0.8;
  private static final double WITHIN_BUDGET_FLOOR = 0.8;

  /** スコア降順、評判降順、登録順、id 昇順。 */
  public static final Comparator<ScoredOffer<?>> RANKING =
      Comparator.<ScoredOffer<?>>comparingDouble(ScoredOffer::score)
          .reversed()
          .thenComparing(
              Comparator.<ScoredOffer<?>>comparingDouble(ScoredOffer::reputation).reversed())
          .thenComparing(scored -> scored.offer().createdAt())
          .thenComparingLong(scored -> scored.offer().id());

  private final MatchingProperties properties;

  /**
   * 役割: 1 件の offer を評価し、候補になり得る場合のみスコアを返す。
   * 動作: 自己マッチ/旅程不一致/必須条件違反/空き無し/許容幅を超える価格は empty を返す。
   * 前提: request と offer は同じ domain の policy で評価する。
   */
  public <R extends HelpRequest, O extends HelpOffer> Optional<ScoredOffer<O>> score(
      MatchingPolicy<R, O> policy, R request, O offer) {
    if (Objects.equals(request.requesterId(), offer.helperId())) {
      return Optional.empty();
    }
    if (!policy.isItineraryCompatible(request, offer)
        || policy.intrinsicViolation(request, offer).isPresent()
        || !policy.hasCapacityFor(request, offer)) {
      return Optional.empty();
    }
    final OptionalDouble priceFit = priceFit(request.offeredAmount(), offer.price());
    if (priceFit.isEmpty()) {
      return Optional.empty();
    }
    final double reputation = reputation(offer);
    final OptionalDouble capability = policy.capabilityFit(request, offer);

    final MatchingProperties.Scoring weights = properties.scoring();
    double weighted =
        weights.priceWeight() * priceFit.getAsDouble() + weights.reputationWeight() * reputation;
    double totalWeight = weights.priceWeight() + weights.reputationWeight();
    if (capability.isPresent()) {
      weighted += weights.capabilityWeight() * capability.getAsDouble();
      totalWeight += weights.capabilityWeight();
    }
    final double score = totalWeight <= 0 ? 0.0 : clamp(weighted / totalWeight);
    return Optional.of(
        new ScoredOffer<>(offer, score, reputation, policy.recommendationReason(offer)));
  }

  /**
   * 役割: 予算に対する価格の近さを返す。
   * 動作: 予算内は安いほど 1.0 に近く、予算ちょうどで 0.8。予算超過は許容幅の上限で 0.0 まで線形に下がる。
   * 前提: 許容幅を超える場合と、予算 0 に有償の offer が来た場合は empty を返し、候補から外す。
   */
  @VisibleForTesting
  OptionalDouble priceFit(BigDecimal offeredAmount, BigDecimal price) {
    final double offered = offeredAmount == null ? 0.0 : offeredAmount.doubleValue();
    final double asked = price == null ? 0.0 : price.doubleValue();
    if (offered <= 0) {
      // 予算 0 は比率の基準が無いため、無償の offer だけを受け付ける
      return asked <= 0 ? OptionalDouble.of(1.0) : OptionalDouble.empty();
    }
    if (asked <= offered) {
      final double savings = (offered - asked) / offered;
      return OptionalDouble.of(WITHIN_BUDGET_FLOOR + (1.0 - WITHIN_BUDGET_FLOOR) * savings);
    }
    final double overageRatio = (asked - offered) / offered;
    final double tolerance = properties.priceTolerance();
    if (tolerance <= 0 || overageRatio > tolerance) {
      return OptionalDouble.empty();
    }
    return OptionalDouble.of(WITHIN_BUDGET_FLOOR * (1.0 - overageRatio / tolerance));
  }

  /** 実績が無い helper は中立値。評価がある場合は評価を重く見る。 */
  @VisibleForTesting
  double reputation(HelpOffer offer) {
    final MatchingProperties.Scoring scoring = properties.scoring();
    final double rating = offer.averageRating() == null ? 0.0 : offer.averageRating().doubleValue();
    final int completed = Math.max(offer.completedCount(), 0);
    if (completed == 0 && rating <= 0) {
      return scoring.neutralReputation();
    }
    final double experiencePart =
        Math.min(completed, scoring.experienceCap()) / (double) scoring.experienceCap();
    if (rating <= 0) {
      // 未評価の実績は中立値への上乗せとして扱い、新規 helper を下回らない
      final double neutral = scoring.neutralReputation();
      return clamp(neutral + (1.0 - neutral) * (1.0 - RATING_SHARE) * experiencePart);
    }
    return clamp(RATING_SHARE * clamp(rating / MAX_RATING) + (1.0 - RATING_SHARE) * experiencePart);
  }

  private static double clamp(double value) {
    return Math.max(0.0, Math.min(1.0, value));
  }
}
