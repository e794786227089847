/*
 * どこで: Common 共通設定
 * 何を: Clock を DI 可能にする
 * なぜ: トークン期限判定や event の occurred_at をテストで固定時刻に差し替えるため
 */
package com.opulenthorizons.common.config;

import java.time.Clock;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TimeConfig {

  @Bean
  @ConditionalOnMissingBean(Clock.class)
  public Clock clock() {
    return Clock.systemUTC();
  }
}
