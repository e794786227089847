/*
 * どこで: Lead Gateway ツール API
 * 何を: ツール名と型付きの入出力、ハンドラの組を表す
 * なぜ: 実行時の型推測に頼らず、登録時点で入出力の契約を固定するため
 */
package com.opulenthorizons.leadgateway.tool;

import java.util.function.Function;

public record ToolDefinition<Q, R>(
    String name,
    String description,
    Class<Q> requestType,
    Class<R> responseType,
    Function<Q, R> handler) {

  public static <Q, R> ToolDefinition<Q, R> of(
      String name,
      String description,
      Class<Q> requestType,
      Class<R> responseType,
      Function<Q, R> handler) {
    return new ToolDefinition<>(name, description, requestType, responseType, handler);
  }

  /** 型チェック済みのリクエストでハンドラを呼ぶ。 */
  public R invoke(Object request) {
    return handler.apply(requestType.cast(request));
  }
}
