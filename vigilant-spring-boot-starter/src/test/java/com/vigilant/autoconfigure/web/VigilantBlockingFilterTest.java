package com.vigilant.autoconfigure.web;

import com.vigilant.core.store.DecisionStore;
import com.vigilant.core.store.InMemoryDecisionStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("VigilantBlockingFilter")
class VigilantBlockingFilterTest {

    private InMemoryDecisionStore decisions;
    private MockHttpServletRequest request;
    private MockHttpServletResponse response;
    private MockFilterChain chain;

    @BeforeEach
    void setUp() {
        decisions = new InMemoryDecisionStore();
        request = new MockHttpServletRequest("GET", "/api/bookings");
        request.setRemoteAddr("203.0.113.7");
        response = new MockHttpServletResponse();
        chain = new MockFilterChain();
    }

    @AfterEach
    void clearSecurityContext() {
        SecurityContextHolder.clearContext();
    }

    @Test
    @DisplayName("Should pass requests from unblocked sources")
    void shouldPassThrough() throws Exception {
        new VigilantBlockingFilter(decisions).doFilter(request, response, chain);

        assertThat(chain.getRequest()).isSameAs(request);
        assertThat(response.getStatus()).isEqualTo(200);
    }

    @Test
    @DisplayName("Should reject a blocked IP with 403")
    void shouldRejectBlockedIp() throws Exception {
        decisions.block("ip:203.0.113.7", "brute force", Duration.ofHours(1));

        new VigilantBlockingFilter(decisions).doFilter(request, response, chain);

        assertThat(response.getStatus()).isEqualTo(403);
        assertThat(response.getContentAsString()).contains("ip blocked");
        assertThat(chain.getRequest()).isNull();
    }

    @Test
    @DisplayName("Should reject an authenticated user whose account is locked")
    void shouldRejectLockedAccount() throws Exception {
        decisions.block("account:alice", "locked", Duration.ofMinutes(30));
        authenticate("alice");

        new VigilantBlockingFilter(decisions).doFilter(request, response, chain);

        assertThat(response.getStatus()).isEqualTo(403);
        assertThat(response.getContentAsString()).contains("account locked");
    }

    @Test
    @DisplayName("Should reject a user blocked from the tenant named in the request")
    void shouldRejectBlockedTenantAccess() throws Exception {
        decisions.block("tenant-access:t-9:alice", "tenant access violation", Duration.ofHours(1));
        authenticate("alice");
        request.addHeader("X-Tenant-Id", "t-9");

        new VigilantBlockingFilter(decisions).doFilter(request, response, chain);

        assertThat(response.getStatus()).isEqualTo(403);
        assertThat(response.getContentAsString()).contains("tenant access blocked");
    }

    @Test
    @DisplayName("Should let a tenant-blocked user reach other tenants")
    void shouldAllowOtherTenants() throws Exception {
        decisions.block("tenant-access:t-9:alice", "tenant access violation", Duration.ofHours(1));
        authenticate("alice");
        request.addHeader("X-Tenant", "t-1");

        new VigilantBlockingFilter(decisions, "X-Tenant").doFilter(request, response, chain);

        assertThat(chain.getRequest()).isSameAs(request);
    }

    @Test
    @DisplayName("Should allow reads but reject writes under a read-only restriction")
    void shouldEnforceReadOnly() throws Exception {
        decisions.put("restrict:permissions:alice", "read-only", Duration.ofHours(1));
        authenticate("alice");

        new VigilantBlockingFilter(decisions).doFilter(request, response, chain);
        assertThat(chain.getRequest()).isSameAs(request);

        MockHttpServletRequest write = new MockHttpServletRequest("POST", "/api/bookings");
        write.setRemoteAddr("203.0.113.7");
        MockHttpServletResponse rejected = new MockHttpServletResponse();
        MockFilterChain writeChain = new MockFilterChain();
        new VigilantBlockingFilter(decisions).doFilter(write, rejected, writeChain);

        assertThat(rejected.getStatus()).isEqualTo(403);
        assertThat(rejected.getContentAsString()).contains("read-only restriction");
        assertThat(writeChain.getRequest()).isNull();
    }

    @Test
    @DisplayName("Should reject every request under a data-access restriction")
    void shouldEnforceDataAccessRestriction() throws Exception {
        decisions.put("restrict:data_access:alice", "denied", Duration.ofHours(1));
        authenticate("alice");

        new VigilantBlockingFilter(decisions).doFilter(request, response, chain);

        assertThat(response.getStatus()).isEqualTo(403);
        assertThat(response.getContentAsString()).contains("data access restricted");
    }

    @Test
    @DisplayName("Should expose a concurrent-session limit to the application")
    void shouldExposeSessionLimit() throws Exception {
        decisions.put("restrict:concurrent_sessions:alice", "2", Duration.ofHours(1));
        authenticate("alice");

        new VigilantBlockingFilter(decisions).doFilter(request, response, chain);

        assertThat(chain.getRequest()).isSameAs(request);
        assertThat(request.getAttribute(VigilantBlockingFilter.SESSION_LIMIT_ATTRIBUTE)).isEqualTo(2);
    }

    @Test
    @DisplayName("Should let the request through when the store fails")
    void shouldFailOpen() throws Exception {
        DecisionStore broken = mock(DecisionStore.class);
        when(broken.isBlocked(anyString())).thenThrow(new IllegalStateException("redis down"));

        new VigilantBlockingFilter(broken).doFilter(request, response, chain);

        assertThat(chain.getRequest()).isSameAs(request);
    }

    private static void authenticate(String user) {
        SecurityContextHolder.getContext().setAuthentication(
                new UsernamePasswordAuthenticationToken(user, "n/a", List.of()));
    }
}
