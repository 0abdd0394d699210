package com.example.storefront.config;

import com.example.storefront.security.AdminTokenInterceptor;
import com.example.storefront.service.AdminSessionService;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
@RequiredArgsConstructor
public class WebConfig implements WebMvcConfigurer {

    static final String ADMIN_PATHS = "/api/admin/**";
    static final String LOGIN_PATH = "/api/admin/login";

    private final AdminSessionService adminSessionService;
    private final AdminProperties adminProperties;
    private final CorsProperties corsProperties;

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(new AdminTokenInterceptor(adminSessionService, adminProperties))
            .addPathPatterns(ADMIN_PATHS)
            .excludePathPatterns(LOGIN_PATH);
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/**")
            .allowedOriginPatterns(corsProperties.getAllowedOriginPatterns().toArray(String[]::new))
            .allowedMethods("*")
            .allowedHeaders("*")
            .allowCredentials(true);
    }
}
