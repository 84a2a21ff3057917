package com.flighthelp.matching.service;

import com.flighthelp.matching.model.MatchConfirmedNotice;

/** マッチ成立を当事者へ知らせる外部連携。失敗しても確定結果は変わらない。 */
public interface MatchNotifier {

  void notifyMatchConfirmed(MatchConfirmedNotice notice);
}
