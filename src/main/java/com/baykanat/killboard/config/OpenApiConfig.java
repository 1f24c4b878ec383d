package com.baykanat.killboard.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/** OpenAPI / Swagger UI bean tanımı. */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI killboardOpenApi() {
        return new OpenAPI()
                .info(new Info()
                        .title("Killboard - Killmail Ingestion API")
                        .description("""
                                Ingests killmails for authorized EVE Online characters from ESI, \
                                extracts the referenced entities and persists them idempotently. \
                                Exposes the OAuth login flow and manual job triggers.\
                                """)
                        .version("1.0.0")
                        .contact(new Contact()
                                .name("Burak Aykanat")
                                .email("burak.aykanat12@gmail.com")))
                .servers(List.of(
                        new Server().url("http://localhost:3000").description("Local Development")
                ));
    }
}
