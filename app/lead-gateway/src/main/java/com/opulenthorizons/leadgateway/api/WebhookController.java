/*
 * どこで: Lead Gateway API
 * 何を: 外部サービスからの Webhook を受け付ける
 * なぜ: 署名検証を通った呼び出しだけをイベントとして取り込むため
 */
package com.opulenthorizons.leadgateway.api;

import com.opulenthorizons.leadgateway.api.response.ChallengeResponse;
import com.opulenthorizons.leadgateway.api.response.WebhookAcceptedResponse;
import com.opulenthorizons.leadgateway.webhook.WebhookDispatcher;
import com.opulenthorizons.leadgateway.webhook.WebhookReceipt;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/webhooks")
@RequiredArgsConstructor
public class WebhookController {

  private final WebhookDispatcher webhookDispatcher;

  // 署名は生のバイト列に対して計算されるため、本文はパースせずに受け取る
  @PostMapping("/{source}")
  public ResponseEntity<?> receive(
      @PathVariable("source") String source,
      @RequestHeader HttpHeaders headers,
      @RequestBody(required = false) byte[] body) {
    final WebhookReceipt receipt = webhookDispatcher.dispatch(source, headers, body);
    if (receipt.isChallenge()) {
      return ResponseEntity.ok(new ChallengeResponse(receipt.challenge()));
    }
    return ResponseEntity.ok(
        new WebhookAcceptedResponse(
            receipt.source(),
            receipt.eventId(),
            receipt.eventType(),
            receipt.ohid(),
            receipt.accepted()));
  }
}
