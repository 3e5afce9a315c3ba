package com.caura.txmapper.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Configuration for OpenAPI/Swagger documentation.
 */
@Configuration
public class OpenApiConfig {

    @Value("${spring.application.name}")
    private String applicationName;

    @Value("${server.port:8080}")
    private String serverPort;

    @Bean
    public OpenAPI transactionMapperOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Transaction Mapper API")
                        .description("Resolves payment transactions from bank statements, Stripe, ShiftCare and " +
                                    "paper receipts to registry clients, with confidence scoring and review flags.")
                        .version("1.0.0")
                        .contact(new Contact()
                                .name(applicationName)
                                .email("platform@example.com"))
                        .license(new License()
                                .name("Proprietary")
                                .url("https://example.com/license")))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + serverPort)
                                .description("Development server")
                ));
    }
}
