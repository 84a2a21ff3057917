package com.flighthelp.matching.scoring;

import com.flighthelp.matching.model.HelpOffer;
import java.math.RoundingMode;

final class Reasons {
  private Reasons() {}

  // 評価 > 実績件数 > 既定文言の順で最も強い根拠を 1 つ選ぶ
  static String describe(HelpOffer offer, String completedLabel, String fallback) {
    if (offer.averageRating() != null && offer.averageRating().signum() > 0) {
      return offer.averageRating().setScale(1, RoundingMode.HALF_UP).toPlainString()
          + " star rating";
    }
    if (offer.completedCount() > 0) {
      return offer.completedCount() + " " + completedLabel;
    }
    return fallback;
  }
}
