package com.example.storefront.security;

import com.example.storefront.config.AdminProperties;
import com.example.storefront.service.AdminSessionService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.web.cors.CorsUtils;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Guards admin routes: the bearer token from the admin header must belong to an unexpired session
 * before the handler runs.
 */
@RequiredArgsConstructor
public class AdminTokenInterceptor implements HandlerInterceptor {

    private final AdminSessionService adminSessionService;
    private final AdminProperties adminProperties;

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        if (CorsUtils.isPreFlightRequest(request)) {
            return true;
        }
        adminSessionService.authorize(request.getHeader(adminProperties.getTokenHeader()));
        return true;
    }
}
