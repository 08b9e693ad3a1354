package com.anomalywatch.scoring.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI/Swagger Configuration
 *
 * Accessible at: /swagger-ui.html
 */
@Configuration
public class OpenApiConfig {

    @Value("${spring.application.name:fraud-scoring-service}")
    private String applicationName;

    @Value("${server.port:8000}")
    private String serverPort;

    @Bean
    public OpenAPI fraudScoringOpenAPI() {
        return new OpenAPI()
            .info(new Info()
                .title("AnomalyWatch Fraud Scoring API")
                .version("1.0.0")
                .description("""
                    # AnomalyWatch Fraud Scoring

                    Hybrid fraud scoring: a trained model probability fused with deterministic
                    heuristic rules, returned with a risk tier and ordered risk factors.

                    ## Endpoints

                    - **POST /predict/primary**: payment transactions
                    - **POST /predict/secondary**: card transactions
                    - **GET /**: status and loaded models

                    ## Errors

                    A prediction endpoint whose model is not loaded answers `503`; the other
                    endpoints keep working.
                    """))
            .servers(List.of(
                new Server()
                    .url("http://localhost:" + serverPort)
                    .description(applicationName + " (local)")));
    }
}
