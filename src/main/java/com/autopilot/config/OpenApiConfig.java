package com.autopilot.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI configuration() {
        return new OpenAPI()
                .info(new Info()
                        .title("Autopilot API")
                        .description("REST API для согласования действий агентов, журналов аудита и ручного запуска агентов")
                        .version("v1.0.0"));
    }
}
