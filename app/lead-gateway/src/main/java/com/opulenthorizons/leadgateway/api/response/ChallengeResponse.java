package com.opulenthorizons.leadgateway.api.response;

/** 送信元が登録時に送ってくる検証値をそのまま返す。 */
public record ChallengeResponse(String challenge) {}
