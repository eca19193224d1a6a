package com.energy.anomaly.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI energyAnomalyDetectionOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Energy Anomaly Detection API")
                        .version("1.0.0")
                        .description(
                                "Flags unusual points in tabular energy-consumption time series.\n\n" +
                                "**Detection Pipeline:**\n" +
                                "1. Submit a dataset and configuration via `POST /api/v1/detections`\n" +
                                "2. Build the numeric feature matrix (mean imputation, optional time features)\n" +
                                "3. Score every row with the selected algorithm\n" +
                                "4. Orient scores so that higher means more anomalous\n" +
                                "5. Flag rows scoring strictly above the percentile threshold\n\n" +
                                "**Algorithms:**\n" +
                                "- `isolation_forest` - average isolation path length over random trees\n" +
                                "- `reconstruction` - autoencoder reconstruction error, closed-form PCA fallback\n" +
                                "- `centroid_distance` - distance to the k-means centroid\n" +
                                "- `density` - DBSCAN noise membership\n\n" +
                                "**Errors:** configuration and data problems return 400, numerical failures 422.")
                        .contact(new Contact().name("Energy Analytics Team")));
    }
}
