package com.lumi.backend.global.security;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import com.lumi.backend.global.error.ProblemException;
import com.lumi.backend.modules.auth.application.TokenService;
import com.lumi.backend.modules.auth.application.TokenService.AccessTokenClaims;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Authenticates bearer access tokens. A rejected token leaves the request anonymous and records
 * the problem under {@link #AUTH_ERROR_ATTRIBUTE} for the entry point to report.
 */
@Component
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    public static final String AUTH_ERROR_ATTRIBUTE = JwtAuthenticationFilter.class.getName() + ".error";

    private static final Logger log = LoggerFactory.getLogger(JwtAuthenticationFilter.class);
    private static final String BEARER_PREFIX = "Bearer ";

    private final TokenService tokenService;

    public JwtAuthenticationFilter(TokenService tokenService) {
        this.tokenService = tokenService;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String authorization = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (authorization != null && authorization.startsWith(BEARER_PREFIX)) {
            String token = authorization.substring(BEARER_PREFIX.length()).trim();
            try {
                AccessTokenClaims claims = tokenService.verifyAccessToken(token);
                List<GrantedAuthority> authorities = new ArrayList<>();
                claims.roles().forEach(role -> authorities.add(new SimpleGrantedAuthority("ROLE_" + role)));
                claims.permissions().forEach(permission -> authorities.add(new SimpleGrantedAuthority(permission)));

                JwtAuthenticationPrincipal principal = new JwtAuthenticationPrincipal(
                        claims.userId(),
                        claims.email(),
                        claims.sessionId(),
                        claims.roles(),
                        claims.permissions()
                );

                UsernamePasswordAuthenticationToken authentication =
                        new UsernamePasswordAuthenticationToken(principal, token, authorities);
                authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
                SecurityContextHolder.getContext().setAuthentication(authentication);
            } catch (ProblemException ex) {
                log.debug("Rejected access token on {}: {}", request.getRequestURI(), ex.getCode());
                SecurityContextHolder.clearContext();
                request.setAttribute(AUTH_ERROR_ATTRIBUTE, ex);
            }
        }

        filterChain.doFilter(request, response);
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = request.getServletPath();
        if (request.getMethod().equalsIgnoreCase("OPTIONS")) {
            return true;
        }
        return path.startsWith("/actuator") || path.startsWith("/v3/api-docs") || path.startsWith("/swagger-ui");
    }
}
