package io.projectdesk.backend.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Extracts the Bearer token, verifies it via {@link SessionTokenService} and installs an {@link
 * AuthenticatedUser} principal with a {@code ROLE_<role>} authority. Requests without a token pass
 * through anonymously and are rejected later by the authorization rules.
 */
public class SessionAuthFilter extends OncePerRequestFilter {

  private static final Logger log = LoggerFactory.getLogger(SessionAuthFilter.class);
  private static final String BEARER_PREFIX = "Bearer ";

  private final SessionTokenService sessionTokenService;

  public SessionAuthFilter(SessionTokenService sessionTokenService) {
    this.sessionTokenService = sessionTokenService;
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {

    String authHeader = request.getHeader("Authorization");
    if (authHeader == null || !authHeader.startsWith(BEARER_PREFIX)) {
      filterChain.doFilter(request, response);
      return;
    }

    SessionClaims claims;
    try {
      claims = sessionTokenService.verifyToken(authHeader.substring(BEARER_PREFIX.length()));
    } catch (InvalidSessionTokenException e) {
      log.debug("Session auth failed: {}", e.getMessage());
      response.sendError(HttpServletResponse.SC_UNAUTHORIZED, e.getMessage());
      return;
    }

    var principal = new AuthenticatedUser(claims.userId(), claims.email(), claims.role());
    var authentication =
        new UsernamePasswordAuthenticationToken(
            principal,
            null,
            List.of(new SimpleGrantedAuthority(Roles.AUTHORITY_PREFIX + claims.role().name())));
    SecurityContextHolder.getContext().setAuthentication(authentication);
    filterChain.doFilter(request, response);
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    String path = request.getRequestURI();
    return path.startsWith("/api/auth/") || path.startsWith("/api/webhooks/");
  }
}
