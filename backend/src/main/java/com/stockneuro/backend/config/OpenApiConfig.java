package com.stockneuro.backend.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI stockNeuroOpenApi() {
        return new OpenAPI()
                .info(new Info()
                        .title("StockNeuro Forecasting API")
                        .description("Model training, promotion, forecasting and benchmarking")
                        .version("1.0"));
    }
}
