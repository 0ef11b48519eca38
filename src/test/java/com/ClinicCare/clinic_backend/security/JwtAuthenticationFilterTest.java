package com.ClinicCare.clinic_backend.security;

import com.ClinicCare.clinic_backend.enums.Role;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class JwtAuthenticationFilterTest {

    @Mock
    private JwtTokenProvider jwtTokenProvider;

    @InjectMocks
    private JwtAuthenticationFilter filter;

    @AfterEach
    void clearContext() {
        SecurityContextHolder.clearContext();
    }

    @Test
    @DisplayName("a valid bearer token authenticates the request with the membership role")
    void validToken() throws Exception {
        AuthenticatedUser user = AuthenticatedUser.builder()
                .id(UUID.randomUUID()).email("desk@abc.com").role(Role.STAFF).tenantId(UUID.randomUUID()).build();
        when(jwtTokenProvider.parseToken("good-token")).thenReturn(Optional.of(user));
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/patients");
        request.addHeader("Authorization", "Bearer good-token");
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request, new MockHttpServletResponse(), chain);

        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        assertThat(authentication).isNotNull();
        assertThat(authentication.getPrincipal()).isSameAs(user);
        assertThat(authentication.getAuthorities()).extracting("authority").containsExactly("ROLE_STAFF");
        assertThat(chain.getRequest()).isSameAs(request);
    }

    @Test
    @DisplayName("an invalid token leaves the request anonymous")
    void invalidToken() throws Exception {
        when(jwtTokenProvider.parseToken("bad-token")).thenReturn(Optional.empty());
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/patients");
        request.addHeader("Authorization", "Bearer bad-token");
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request, new MockHttpServletResponse(), chain);

        assertThat(SecurityContextHolder.getContext().getAuthentication()).isNull();
        assertThat(chain.getRequest()).isSameAs(request);
    }

    @Test
    @DisplayName("requests without a bearer header are not inspected")
    void noHeader() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/auth/login");

        filter.doFilter(request, new MockHttpServletResponse(), new MockFilterChain());

        verify(jwtTokenProvider, never()).parseToken(any());
        assertThat(SecurityContextHolder.getContext().getAuthentication()).isNull();
    }
}
