package com.servicevault.identifier.app.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.servicevault.identifier.app.session.SessionResolver;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Requires an owner session ({@code Authorization: Bearer <session>}) on every endpoint except the
 * anonymous public views and the health check. The resolved account id is exposed to controllers
 * as the {@value #USER_ID} request attribute.
 */
@Log4j2
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
@RequiredArgsConstructor
public class OwnerSessionFilter extends OncePerRequestFilter {

  public static final String USER_ID = "userId";

  private static final String BEARER = "Bearer ";

  private final SessionResolver sessionResolver;
  private final ObjectMapper om;

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    if ("OPTIONS".equalsIgnoreCase(request.getMethod())) return true;

    String p = request.getRequestURI();
    if (p.equals("/health")) return true;
    if (p.startsWith("/public/")) return true;
    return p.equals("/error");
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest req, HttpServletResponse res, FilterChain chain)
      throws ServletException, IOException {

    String auth = req.getHeader("Authorization");
    if (auth == null || !auth.startsWith(BEARER)) {
      unauthorized(res, "missing_session");
      return;
    }

    String session = auth.substring(BEARER.length()).trim();
    if (session.isEmpty()) {
      unauthorized(res, "missing_session");
      return;
    }

    String userId = sessionResolver.resolveUserId(session);
    if (userId == null) {
      log.debug("session.invalid path={}", req.getRequestURI());
      unauthorized(res, "invalid_session");
      return;
    }

    req.setAttribute(USER_ID, userId);
    chain.doFilter(req, res);
  }

  private void unauthorized(HttpServletResponse res, String code) throws IOException {
    res.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
    res.setContentType(MediaType.APPLICATION_JSON_VALUE);
    om.writeValue(res.getWriter(), Map.of("error", "UNAUTHORIZED", "message", code));
  }
}
