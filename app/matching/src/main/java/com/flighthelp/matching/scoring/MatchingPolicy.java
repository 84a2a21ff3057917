/*
 * どこで: Matching スコアリング層
 * 何を: domain ごとの照合ルール(旅程・必須条件・容量・能力)を抽象化する
 * なぜ: ランキングと確定処理を domain 非依存のまま 2 系統へ適用するため
 */
package com.flighthelp.matching.scoring;

import com.flighthelp.matching.model.HelpOffer;
import com.flighthelp.matching.model.HelpRequest;
import com.flighthelp.matching.model.ServiceDomain;
import java.util.Optional;
import java.util.OptionalDouble;

public interface MatchingPolicy<R extends HelpRequest, O extends HelpOffer> {

  ServiceDomain domain();

  /** 旅程キーが互換なら true。 */
  boolean isItineraryCompatible(R request, O offer);

  /**
   * 役割: offer の固有能力が request を満たせるかを判定する。
   * 動作: 満たせない場合はその理由を返し、満たせる場合は empty を返す。
   * 前提: 現在の空き状況は見ない。空きは hasCapacityFor で判定する。
   */
  Optional<String> intrinsicViolation(R request, O offer);

  /** 現時点で offer に request を受け入れる空きがあれば true。 */
  boolean hasCapacityFor(R request, O offer);

  /** 0.0 - 1.0 の能力適合度。domain に能力の概念が無い場合は empty。 */
  OptionalDouble capabilityFit(R request, O offer);

  /** 候補一覧に添える推薦理由。 */
  String recommendationReason(O offer);
}
