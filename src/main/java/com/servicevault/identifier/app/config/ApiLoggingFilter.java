package com.servicevault.identifier.app.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import lombok.extern.log4j.Log4j2;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/** One log line per API call, including calls rejected by the session filter. */
@Log4j2
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class ApiLoggingFilter extends OncePerRequestFilter {

  @Override
  protected void doFilterInternal(
      HttpServletRequest req, HttpServletResponse res, FilterChain chain)
      throws ServletException, IOException {

    long t0 = System.currentTimeMillis();
    try {
      chain.doFilter(req, res);
    } finally {
      long ms = System.currentTimeMillis() - t0;
      // public tokens are credentials, keep them out of the logs
      String path = req.getRequestURI();
      if (path.startsWith("/public/property/")) path = "/public/property/***";
      log.info(
          "api.request method={} path={} status={} ms={}",
          req.getMethod(),
          path,
          res.getStatus(),
          ms);
    }
  }
}
