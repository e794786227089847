/*
 * どこで: Lead Gateway 設定
 * 何を: CRM レコード API / トークンエンドポイント用の RestClient とトークン更新用スレッドを提供する
 * なぜ: 外部呼び出しごとに接続/読み取りタイムアウトを必ず設定するため
 */
package com.opulenthorizons.leadgateway.config;

import com.opulenthorizons.common.retry.Sleeper;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
public class CrmClientConfig {

  @Bean
  RestClient crmRestClient(RestClient.Builder builder, CrmApiProperties properties) {
    return builder
        .clone()
        .baseUrl(properties.baseUrl())
        .requestFactory(requestFactory(properties.connectTimeout(), properties.readTimeout()))
        .build();
  }

  @Bean
  RestClient crmTokenRestClient(RestClient.Builder builder, CrmOAuthProperties properties) {
    // トークン URL は絶対 URL で指定するため baseUrl は持たない
    return builder
        .clone()
        .requestFactory(requestFactory(properties.connectTimeout(), properties.readTimeout()))
        .build();
  }

  @Bean(destroyMethod = "shutdownNow")
  ExecutorService crmTokenRefreshExecutor() {
    final AtomicInteger sequence = new AtomicInteger();
    return Executors.newFixedThreadPool(
        1,
        runnable -> {
          final Thread thread =
              new Thread(runnable, "crm-token-refresh-" + sequence.incrementAndGet());
          thread.setDaemon(true);
          return thread;
        });
  }

  @Bean
  Sleeper retrySleeper() {
    return Sleeper.THREAD;
  }

  static SimpleClientHttpRequestFactory requestFactory(
      Duration connectTimeout, Duration readTimeout) {
    final SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
    factory.setConnectTimeout(connectTimeout);
    factory.setReadTimeout(readTimeout);
    return factory;
  }
}
