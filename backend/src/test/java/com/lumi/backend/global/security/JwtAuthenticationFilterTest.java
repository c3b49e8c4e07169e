package com.lumi.backend.global.security;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.lumi.backend.global.error.UnauthorizedProblemException;
import com.lumi.backend.modules.auth.application.TokenService;
import com.lumi.backend.modules.auth.application.TokenService.AccessTokenClaims;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpHeaders;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;

@ExtendWith(MockitoExtension.class)
class JwtAuthenticationFilterTest {

    @Mock
    private TokenService tokenService;

    @InjectMocks
    private JwtAuthenticationFilter filter;

    @AfterEach
    void clearContext() {
        SecurityContextHolder.clearContext();
    }

    @Test
    void validBearerTokenAuthenticatesWithRolesAndPermissions() throws Exception {
        UUID userId = UUID.randomUUID();
        UUID sessionId = UUID.randomUUID();
        OffsetDateTime now = OffsetDateTime.parse("2025-03-01T10:00:00Z");
        when(tokenService.verifyAccessToken("good")).thenReturn(new AccessTokenClaims(userId, sessionId, "jti",
                "jamie@example.com", List.of("ADMIN"), List.of("user:unlock"), now, now.plusMinutes(15)));
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/auth/me");
        request.addHeader(HttpHeaders.AUTHORIZATION, "Bearer good");
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request, new MockHttpServletResponse(), chain);

        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        assertThat(authentication).isNotNull();
        JwtAuthenticationPrincipal principal = (JwtAuthenticationPrincipal) authentication.getPrincipal();
        assertThat(principal.userId()).isEqualTo(userId);
        assertThat(principal.sessionId()).isEqualTo(sessionId);
        assertThat(authentication.getAuthorities()).extracting(GrantedAuthority::getAuthority)
                .containsExactlyInAnyOrder("ROLE_ADMIN", "user:unlock");
        assertThat(chain.getRequest()).isSameAs(request);
    }

    @Test
    void rejectedTokenLeavesRequestAnonymousAndRecordsProblem() throws Exception {
        UnauthorizedProblemException problem = new UnauthorizedProblemException("session_revoked", "revoked");
        when(tokenService.verifyAccessToken("stale")).thenThrow(problem);
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/auth/me");
        request.addHeader(HttpHeaders.AUTHORIZATION, "Bearer stale");
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request, new MockHttpServletResponse(), chain);

        assertThat(SecurityContextHolder.getContext().getAuthentication()).isNull();
        assertThat(request.getAttribute(JwtAuthenticationFilter.AUTH_ERROR_ATTRIBUTE)).isSameAs(problem);
        assertThat(chain.getRequest()).isSameAs(request);
    }

    @Test
    void requestWithoutBearerIsPassedThrough() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/auth/login");
        request.addHeader(HttpHeaders.AUTHORIZATION, "Basic abc");

        filter.doFilter(request, new MockHttpServletResponse(), new MockFilterChain());

        verify(tokenService, never()).verifyAccessToken(anyString());
        assertThat(SecurityContextHolder.getContext().getAuthentication()).isNull();
    }
}
