package com.simboard.backend.global.security;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.util.UUID;

import com.simboard.backend.modules.auth.application.AuthResolver;
import com.simboard.backend.modules.auth.domain.AuthFailureReason;
import com.simboard.backend.modules.auth.domain.AuthMethod;
import com.simboard.backend.modules.auth.domain.AuthResult;
import com.simboard.backend.modules.user.domain.Principal;
import com.simboard.backend.modules.user.domain.Role;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;

@ExtendWith(MockitoExtension.class)
class AuthResolutionFilterTest {

    private static final Principal BOT =
            new Principal(UUID.fromString("00000000-0000-0000-0000-0000000000b1"), "bot@simboard.local", Role.SERVICE_ACCOUNT, true);

    @Mock
    private AuthResolver authResolver;

    private AuthResolutionFilter filter;

    @BeforeEach
    void setUp() {
        filter = new AuthResolutionFilter(authResolver);
    }

    @AfterEach
    void tearDown() {
        SecurityContextHolder.clearContext();
    }

    @Test
    void authenticatedRequestCarriesPrincipalAndMethod() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/users/me");
        when(authResolver.resolve(request)).thenReturn(AuthResult.authenticated(BOT, AuthMethod.API_TOKEN));
        CapturingChain chain = new CapturingChain();

        filter.doFilter(request, new MockHttpServletResponse(), chain);

        Authentication authentication = chain.authentication;
        assertThat(authentication).isNotNull();
        assertThat(authentication.getPrincipal()).isEqualTo(AuthenticatedPrincipal.of(BOT, AuthMethod.API_TOKEN));
        assertThat(authentication.getAuthorities()).extracting(GrantedAuthority::getAuthority)
                .containsExactly("ROLE_SERVICE_ACCOUNT");
    }

    @Test
    void failedRequestStaysAnonymousAndKeepsReasonInternal() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/users/me");
        MockHttpServletResponse response = new MockHttpServletResponse();
        when(authResolver.resolve(request)).thenReturn(AuthResult.failed(AuthFailureReason.TOKEN_REVOKED));
        CapturingChain chain = new CapturingChain();

        filter.doFilter(request, response, chain);

        assertThat(chain.invoked).isTrue();
        assertThat(chain.authentication).isNull();
        assertThat(request.getAttribute(AuthResolutionFilter.FAILURE_REASON_ATTRIBUTE))
                .isEqualTo(AuthFailureReason.TOKEN_REVOKED);
        assertThat(response.getContentAsString()).isEmpty();
    }

    @Test
    void publicPathsSkipResolution() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/actuator/health");
        CapturingChain chain = new CapturingChain();

        filter.doFilter(request, new MockHttpServletResponse(), chain);

        assertThat(chain.invoked).isTrue();
        verifyNoInteractions(authResolver);
    }

    private static final class CapturingChain implements FilterChain {

        private boolean invoked;
        private Authentication authentication;

        @Override
        public void doFilter(ServletRequest request, ServletResponse response) {
            invoked = true;
            authentication = SecurityContextHolder.getContext().getAuthentication();
        }
    }
}
