/*
 * どこで: Lead Gateway CRM 下流 DTO
 * 何を: OAuth2 トークンエンドポイントの応答を表現する
 * なぜ: 200 応答に error が入るプロバイダもあるため、成功/失敗を同じ型で受けるため
 */
package com.opulenthorizons.leadgateway.crm.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TokenEndpointResponse(
    String accessToken, Long expiresIn, String refreshToken, String tokenType, String error) {}
