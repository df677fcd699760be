package com.nextride.backend.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

        @Bean
        public OpenAPI nextRideOpenAPI() {
                return new OpenAPI()
                                .info(new Info()
                                                .title("NextRide API documentation")
                                                .description(
                                                                "### NextRide API\n\n" +
                                                                                "NextRide ingests the MTA subway GTFS-Realtime feeds and serves live departures and service alerts.\n\n"
                                                                                +
                                                                                "#### Key Features:\n" +
                                                                                "- **Departures**: Next train per route at a platform, or the next three trains of one route.\n"
                                                                                +
                                                                                "- **Alerts**: Service alerts matched against a rider's station and route subscriptions.\n"
                                                                                +
                                                                                "- **Subscriptions**: Subscribe to stations or routes to follow their alerts.")
                                                .version("v1.0.0")
                                                .license(new License()
                                                                .name("Apache 2.0")
                                                                .url("http://springdoc.org")))
                                .servers(List.of(
                                                new Server().url("http://localhost:8080")
                                                                .description("Local Development (HTTP)")));
        }
}
