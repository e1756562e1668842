package com.example.admission;

import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * 保護対象のパスに AdmissionGate を挟む。
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    private final AdmissionGate admissionGate;
    private final ApiKeyProperties apiKeyProperties;

    public WebConfig(AdmissionGate admissionGate, ApiKeyProperties apiKeyProperties) {
        this.admissionGate = admissionGate;
        this.apiKeyProperties = apiKeyProperties;
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(admissionGate)
                .addPathPatterns(apiKeyProperties.getProtectedPaths());
    }
}
