/*
 * どこで: Matching 期限切れワーカー
 * 何を: request の期限切れ処理をスケジュールで起動する
 * なぜ: 手動介入なしで過去日の依頼を片付けるため
 */
package com.flighthelp.matching.worker;

import com.flighthelp.matching.service.HelpRequestExpiryService;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "matching.expiry.enabled", havingValue = "true")
public class HelpRequestExpiryWorker {

  private final HelpRequestExpiryService expiryService;

  @Scheduled(fixedDelayString = "${matching.expiry.interval}")
  public void run() {
    expiryService.expire();
  }
}
