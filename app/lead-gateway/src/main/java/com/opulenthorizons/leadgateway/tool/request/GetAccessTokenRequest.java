package com.opulenthorizons.leadgateway.tool.request;

/** get_access_token は入力を取らない。 */
public record GetAccessTokenRequest() {}
