/*
 * どこで: Lead Gateway セキュリティ
 * 何を: /tools 配下の呼び出しを API キーで認証する
 * なぜ: キー未設定時も含め、正しいキーを持たない呼び出しにツールを実行させないため
 */
package com.opulenthorizons.leadgateway.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

public class ApiKeyAuthenticationFilter extends OncePerRequestFilter {

  private static final Logger logger = LoggerFactory.getLogger(ApiKeyAuthenticationFilter.class);
  static final String TOOL_ROLE = "ROLE_TOOL_CLIENT";
  private static final String BEARER_PREFIX = "Bearer ";

  private final ToolApiProperties properties;

  public ApiKeyAuthenticationFilter(ToolApiProperties properties) {
    this.properties = properties;
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    final String uri = request.getRequestURI();
    return uri == null || !(uri.equals("/tools") || uri.startsWith("/tools/"));
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    if (isValidKey(extractKey(request.getHeader(properties.headerName())))) {
      SecurityContextHolder.getContext()
          .setAuthentication(
              new UsernamePasswordAuthenticationToken(
                  "tool-client", "N/A", List.of(new SimpleGrantedAuthority(TOOL_ROLE))));
    } else {
      logger.debug("tool api key missing or invalid path={}", request.getRequestURI());
    }
    filterChain.doFilter(request, response);
  }

  private String extractKey(String headerValue) {
    if (headerValue == null) {
      return null;
    }
    final String trimmed = headerValue.trim();
    if (HttpHeaders.AUTHORIZATION.equalsIgnoreCase(properties.headerName())) {
      if (!trimmed.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
        return null;
      }
      return trimmed.substring(BEARER_PREFIX.length()).trim();
    }
    return trimmed;
  }

  private boolean isValidKey(String actualKey) {
    // キー未設定なら常に拒否する
    if (actualKey == null || properties.apiKey().isBlank()) {
      return false;
    }
    return MessageDigest.isEqual(
        actualKey.getBytes(StandardCharsets.UTF_8),
        properties.apiKey().getBytes(StandardCharsets.UTF_8));
  }
}
