package com.fairwaytour.web;

import com.fairwaytour.config.FairwayRuntimeProperties;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Rejects privileged transitions (scorecard lock/unlock/DQ, finalize, reopen) from non-admin callers.
 */
public class AdminRouteGuardInterceptor implements HandlerInterceptor {

    private static final Logger log = LoggerFactory.getLogger(AdminRouteGuardInterceptor.class);

    private final FairwayRuntimeProperties fairwayRuntimeProperties;

    public AdminRouteGuardInterceptor(FairwayRuntimeProperties fairwayRuntimeProperties) {
        this.fairwayRuntimeProperties = fairwayRuntimeProperties;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        String adminHeader = request.getHeader(fairwayRuntimeProperties.getApi().getAdminHeader());
        if (CallerContextArgumentResolver.isAdmin(adminHeader)) {
            return true;
        }

        log.warn("Non-admin caller rejected on {} {}", request.getMethod(), request.getRequestURI());
        throw AuthorizationException.adminRequired();
    }
}
