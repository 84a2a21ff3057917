/*
 * どこで: Matching Repository 層
 * 何を: request/offer の参照と、マッチ成立/取消/無効化の状態遷移を抽象化する
 * なぜ: 状態遷移を条件付き UPDATE に閉じ込め、Service から SQL 詳細を切り離すため
 */
package com.flighthelp.matching.repository;

import com.flighthelp.matching.model.HelpOffer;
import com.flighthelp.matching.model.HelpRequest;
import com.flighthelp.matching.model.ServiceDomain;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

public interface HelpMatchRepository<R extends HelpRequest, O extends HelpOffer> {

  ServiceDomain domain();

  Optional<R> findRequestById(long requestId);

  /** 有効かつ未マッチの request のみ返す。 */
  default Optional<R> findActiveUnmatchedRequest(long requestId) {
    return findRequestById(requestId).filter(request -> request.active() && !request.matched());
  }

  Optional<O> findOfferById(long offerId);

  /**
   * 役割: request と同じ旅程キーを持つ募集中 offer を返す。
   * 動作: 旅程インデックスで絞り込み、request 本人の offer は除外する。
   * 前提: 時刻の許容幅や容量などの細かい判定は呼び出し側で行う。
   */
  List<O> findAvailableOffersFor(R request);

  /**
   * 役割: request と offer を 1 トランザクションで結び付け、監査記録を残す。
   * 動作: request は version 一致かつ有効/未マッチ、offer は募集中かつ空きありの場合のみ更新する。
   * 前提: いずれかの条件付き更新が 0 件なら StaleMatchStateException を送出しロールバックする。
   */
  void bindMatch(R request, O offer, Instant matchedAt);

  /**
   * 役割: 成立済みのマッチを取り消し、offer の空きを戻す。
   * 動作: request が version 一致かつ同じ offer に結び付いている場合のみ更新する。
   * 前提: 条件付き更新が 0 件なら StaleMatchStateException を送出しロールバックする。
   */
  void releaseMatch(R request, O offer, String actorId, Instant releasedAt);

  /** 有効かつ未マッチの request を無効化する。更新できた場合のみ true。 */
  boolean deactivateRequest(long requestId);

  /** 日付が date より前の有効な未マッチ request を無効化し、件数を返す。 */
  int deactivateRequestsBefore(LocalDate date);
}
