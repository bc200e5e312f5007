package com.artinerary.auth.web;

import com.artinerary.auth.config.AuthProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
@EnableConfigurationProperties(AuthProperties.class)
public class WebMvcAuthConfig implements WebMvcConfigurer {

    private final GatewayIdentityInterceptor gatewayIdentityInterceptor;

    public WebMvcAuthConfig(GatewayIdentityInterceptor gatewayIdentityInterceptor) {
        this.gatewayIdentityInterceptor = gatewayIdentityInterceptor;
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(gatewayIdentityInterceptor)
                .addPathPatterns("/**");
    }
}
