package com.community.portal.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Web配置类，用于配置CORS等Web相关设置
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    // 允许跨域的前端地址，多个用逗号分隔
    @Value("${portal.cors.allowed-origins:http://localhost:8000}")
    private String[] allowedOrigins;

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        // 只开放 API 路径
        registry.addMapping("/api/**")
                .allowedOrigins(allowedOrigins)
                // 统计接口只有 GET / POST
                .allowedMethods("GET", "POST", "OPTIONS")
                .allowedHeaders("*")
                .allowCredentials(true)
                // 预检请求的有效期，单位秒
                .maxAge(3600);
    }
}
