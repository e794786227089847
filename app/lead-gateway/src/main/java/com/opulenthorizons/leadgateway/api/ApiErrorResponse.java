/*
 * どこで: Lead Gateway API
 * 何を: エラーレスポンスの共通フォーマットを定義する
 * なぜ: ツール呼び出し元がエラー原因を機械的に識別できるようにするため
 */
package com.opulenthorizons.leadgateway.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ApiErrorResponse(ApiErrorCode code, String message) {}
