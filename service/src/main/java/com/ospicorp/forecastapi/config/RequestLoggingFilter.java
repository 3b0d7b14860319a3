package com.ospicorp.forecastapi.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Access log line per request, tagged with a request id that is also returned to the caller.
 * Async analyses complete on another thread, so the line is written when the async dispatch
 * finishes rather than when the servlet thread is released.
 */
@Component
public class RequestLoggingFilter extends OncePerRequestFilter {

  private static final Logger log = LoggerFactory.getLogger(RequestLoggingFilter.class);
  static final String REQUEST_ID_HEADER = "X-Request-Id";
  private static final String MDC_KEY = "requestId";
  private static final String START_ATTRIBUTE = RequestLoggingFilter.class.getName() + ".start";

  @Override
  protected boolean shouldNotFilterAsyncDispatch() {
    return false;
  }

  @Override
  protected void doFilterInternal(@NonNull HttpServletRequest request,
      @NonNull HttpServletResponse response, @NonNull FilterChain filterChain)
      throws ServletException, IOException {
    String requestId = requestId(request);
    if (request.getAttribute(START_ATTRIBUTE) == null) {
      request.setAttribute(START_ATTRIBUTE, System.currentTimeMillis());
      response.setHeader(REQUEST_ID_HEADER, requestId);
    }
    MDC.put(MDC_KEY, requestId);
    try {
      filterChain.doFilter(request, response);
    } catch (ServletException | IOException | RuntimeException ex) {
      log.error("Request {} {} failed: {}", request.getMethod(), uriWithQuery(request),
          ex.getMessage(), ex);
      throw ex;
    } finally {
      if (!isAsyncStarted(request)) {
        long duration = System.currentTimeMillis() - (Long) request.getAttribute(START_ATTRIBUTE);
        log.info("HTTP {} {} ({} bytes) -> {} ({} ms)",
            request.getMethod(),
            uriWithQuery(request),
            request.getContentLengthLong(),
            response.getStatus(),
            duration);
      }
      MDC.remove(MDC_KEY);
    }
  }

  private String requestId(HttpServletRequest request) {
    Object existing = request.getAttribute(MDC_KEY);
    if (existing instanceof String id) {
      return id;
    }
    String header = request.getHeader(REQUEST_ID_HEADER);
    String id = header != null && !header.isBlank() ? header.trim() : UUID.randomUUID().toString();
    request.setAttribute(MDC_KEY, id);
    return id;
  }

  private String uriWithQuery(HttpServletRequest request) {
    String queryString = request.getQueryString();
    if (queryString == null || queryString.isBlank()) {
      return request.getRequestURI();
    }
    return request.getRequestURI() + "?" + queryString;
  }
}
