package com.health.anomaly.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI healthAnomalyOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Health Indicator Anomaly API")
                        .version("1.0.0")
                        .description(
                                "Trend anomaly detection for per-country health-indicator series.\n\n" +
                                "**Training:** `POST /api/v1/models/train` pools every country's values per indicator, " +
                                "fits a z-score normalizer and a 1-4-2-4-1 autoencoder, and stores both.\n\n" +
                                "**Analysis:** `POST /api/v1/analysis/run` scores the latest value of each " +
                                "country series against its indicator model:\n" +
                                "1. Standardize the series with the indicator's mean/std\n" +
                                "2. Reconstruct it with the autoencoder and record the latest reconstruction error\n" +
                                "3. Classify severity from the absolute standardized latest value: " +
                                "**none**, **low**, **medium**, **high**\n" +
                                "4. Label the trend from the least-squares slope: " +
                                "**improving**, **declining**, **stable**, **unknown**\n" +
                                "5. Attach an Observation + DiagnosticReport for medium and high severity")
                        .contact(new Contact().name("Health Analytics Team")));
    }
}
