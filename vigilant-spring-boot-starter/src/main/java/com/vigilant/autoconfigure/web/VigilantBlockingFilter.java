package com.vigilant.autoconfigure.web;

import com.vigilant.core.store.DecisionStore;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.Set;

/**
 * Enforces the decisions written by the response handlers: IP, account, user and
 * session blocks, per-tenant access blocks, and the read-only and data-access
 * restrictions. A concurrent-session limit is handed to the application as the
 * {@value #SESSION_LIMIT_ATTRIBUTE} request attribute.
 * A failing lookup never blocks the request.
 */
public class VigilantBlockingFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(VigilantBlockingFilter.class);

    public static final String SESSION_LIMIT_ATTRIBUTE = "vigilant.concurrentSessionLimit";

    private static final Set<String> READ_ONLY_METHODS = Set.of("GET", "HEAD", "OPTIONS", "TRACE");

    private final DecisionStore decisionStore;
    private final String tenantHeader;

    public VigilantBlockingFilter(DecisionStore decisionStore) {
        this(decisionStore, "X-Tenant-Id");
    }

    public VigilantBlockingFilter(DecisionStore decisionStore, String tenantHeader) {
        this.decisionStore = decisionStore;
        this.tenantHeader = tenantHeader;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response,
            FilterChain filterChain) throws ServletException, IOException {
        String reason = null;
        try {
            reason = blockReason(request);
        } catch (Exception e) {
            log.error("[Vigilant] Block lookup failed (request not blocked): {}", e.getMessage());
        }

        if (reason != null) {
            log.warn("[Vigilant] Rejected {} {}: {}", request.getMethod(), request.getRequestURI(), reason);
            response.setStatus(HttpServletResponse.SC_FORBIDDEN);
            response.setContentType(MediaType.APPLICATION_JSON_VALUE);
            response.getWriter().write("{\"error\":\"Request blocked by Vigilant\",\"reason\":\"" + reason + "\"}");
            return;
        }
        filterChain.doFilter(request, response);
    }

    private String blockReason(HttpServletRequest request) {
        if (decisionStore.isBlocked("ip:" + request.getRemoteAddr())) {
            return "ip blocked";
        }
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        String user = authentication != null && authentication.isAuthenticated() ? authentication.getName() : null;
        if (user == null) {
            return null;
        }
        if (decisionStore.isBlocked("account:" + user)) {
            return "account locked";
        }
        if (decisionStore.isBlocked("user:" + user) || decisionStore.isBlocked("session:" + user)) {
            return "user blocked";
        }
        String tenant = tenantHeader != null ? request.getHeader(tenantHeader) : null;
        if (tenant != null && !tenant.isBlank() && decisionStore.isBlocked("tenant-access:" + tenant + ":" + user)) {
            return "tenant access blocked";
        }
        return restrictionReason(request, user);
    }

    private String restrictionReason(HttpServletRequest request, String user) {
        if ("denied".equals(decisionStore.get("restrict:data_access:" + user))) {
            return "data access restricted";
        }
        if ("read-only".equals(decisionStore.get("restrict:permissions:" + user))
                && !READ_ONLY_METHODS.contains(request.getMethod())) {
            return "read-only restriction";
        }
        String sessionLimit = decisionStore.get("restrict:concurrent_sessions:" + user);
        if (sessionLimit != null) {
            request.setAttribute(SESSION_LIMIT_ATTRIBUTE, Integer.valueOf(sessionLimit));
        }
        return null;
    }
}
