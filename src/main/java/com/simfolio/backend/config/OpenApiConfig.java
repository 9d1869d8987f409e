package com.simfolio.backend.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI simfolioOpenApi() {
        return new OpenAPI()
                .info(new Info()
                        .title("Simfolio Ledger API")
                        .description("Simulated brokerage trades, positions, equity curve and portfolio analytics")
                        .version("1.0"));
    }
}
