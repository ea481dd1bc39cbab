package com.clarifi.backend.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI clarifiOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Clarifi Dashboard API")
                        .description("Read-side dashboard projections: summary, spending by category, budgets, goals and insights.")
                        .version("v1")
                        .contact(new Contact()
                                .name("Clarifi")
                                .email("support@clarifi.app")
                        )
                );
    }
}
