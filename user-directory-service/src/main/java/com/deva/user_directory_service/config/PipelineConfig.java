package com.deva.user_directory_service.config;

import com.deva.user_directory_service.pipeline.AuthenticationMiddleware;
import com.deva.user_directory_service.pipeline.ErrorHandlingMiddleware;
import com.deva.user_directory_service.pipeline.LoggingMiddleware;
import com.deva.user_directory_service.pipeline.MiddlewarePipeline;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;

@Configuration
@EnableConfigurationProperties(UserDirectoryProperties.class)
public class PipelineConfig {

    @Bean
    public ErrorHandlingMiddleware errorHandlingMiddleware(ObjectMapper objectMapper, MeterRegistry meterRegistry) {
        return new ErrorHandlingMiddleware(objectMapper, meterRegistry);
    }

    @Bean
    public AuthenticationMiddleware authenticationMiddleware(UserDirectoryProperties properties,
                                                             ObjectMapper objectMapper,
                                                             MeterRegistry meterRegistry) {
        return new AuthenticationMiddleware(properties.auth(), objectMapper, meterRegistry);
    }

    @Bean
    public LoggingMiddleware loggingMiddleware(UserDirectoryProperties properties) {
        return new LoggingMiddleware(properties.logging());
    }

    // outermost first
    @Bean
    public MiddlewarePipeline middlewarePipeline(ErrorHandlingMiddleware errorHandling,
                                                 AuthenticationMiddleware authentication,
                                                 LoggingMiddleware logging) {
        return MiddlewarePipeline.of(errorHandling, authentication, logging);
    }

    @Bean
    public FilterRegistrationBean<MiddlewarePipelineFilter> middlewarePipelineFilterRegistration(
            MiddlewarePipeline pipeline, UserDirectoryProperties properties, ObjectMapper objectMapper) {
        FilterRegistrationBean<MiddlewarePipelineFilter> registration =
                new FilterRegistrationBean<>(new MiddlewarePipelineFilter(pipeline, properties.pipeline(), objectMapper));
        registration.setOrder(Ordered.HIGHEST_PRECEDENCE + 10);
        return registration;
    }
}
