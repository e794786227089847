/*
 * どこで: Lead Gateway サービス層
 * 何を: 同定/署名検証/トークン更新/CRM 同期のメトリクス記録を集約する
 * なぜ: 取り込みパイプラインと CRM 同期の健全性を運用で継続監視できるようにするため
 */
package com.opulenthorizons.leadgateway.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class LeadGatewayMetrics {

  static final String METRIC_IDENTITY_RESOLUTION_TOTAL = "lead_gateway.identity.resolution.total";
  static final String METRIC_SIGNATURE_VERIFICATION_TOTAL =
      "lead_gateway.webhook.signature.total";
  static final String METRIC_TOKEN_REFRESH_TOTAL = "lead_gateway.crm.token.refresh.total";
  static final String METRIC_RECONCILE_TOTAL = "lead_gateway.crm.reconcile.total";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> counters = new ConcurrentHashMap<>();

  public LeadGatewayMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  public void recordIdentityResolution(String outcome) {
    increment(METRIC_IDENTITY_RESOLUTION_TOTAL, "Identity resolutions", "outcome", outcome);
  }

  public void recordSignatureVerification(String source, String result) {
    increment(
        METRIC_SIGNATURE_VERIFICATION_TOTAL,
        "Webhook signature verifications",
        "source",
        source,
        "result",
        result);
  }

  public void recordTokenRefresh(String result) {
    increment(METRIC_TOKEN_REFRESH_TOTAL, "CRM access token refreshes", "result", result);
  }

  public void recordReconcile(String direction, String result) {
    increment(
        METRIC_RECONCILE_TOTAL,
        "CRM reconciliations",
        "direction",
        direction,
        "result",
        result);
  }

  private void increment(String name, String description, String... tagKeyValues) {
    final String key = name + ":" + String.join(":", tagKeyValues);
    counters
        .computeIfAbsent(
            key,
            ignored ->
                Counter.builder(name)
                    .description(description)
                    .tags(Tags.of(tagKeyValues))
                    .register(meterRegistry))
        .increment();
  }
}
