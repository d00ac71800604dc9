package uk.gegc.examinsight.shared.config;

import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * API documentation groups.
 */
@Configuration
public class OpenApiGroupConfig {

    @Bean
    public GroupedOpenApi examsGroup() {
        return GroupedOpenApi.builder()
                .group("exams")
                .displayName("Exams & Attempts")
                .pathsToMatch("/api/v1/exams/**", "/api/v1/attempts/**")
                .build();
    }

    @Bean
    public GroupedOpenApi progressGroup() {
        return GroupedOpenApi.builder()
                .group("progress")
                .displayName("Performance & Achievements")
                .pathsToMatch("/api/v1/performance/**", "/api/v1/achievements/**")
                .build();
    }
}
