package com.georep.lookup.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI (Swagger) configuration for API documentation.
 *
 * - Swagger UI: http://localhost:8080/swagger-ui.html
 * - OpenAPI JSON: http://localhost:8080/v3/api-docs
 */
@Configuration
public class OpenApiConfig {

    @Value("${server.port:8080}")
    private String serverPort;

    @Bean
    public OpenAPI geoRepresentativeOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Geo-Representative Lookup API")
                        .description("Find the MLA (Member of Legislative Assembly) and MP (Member of Parliament) " +
                                "for any coordinate within Bangalore, Karnataka.\n\n" +
                                "## How a lookup works\n\n" +
                                "1. Ray-casting point-in-polygon test against assembly constituency boundaries\n" +
                                "2. Assembly → parliamentary constituency via the 2008 delimitation table\n" +
                                "3. Representative records with name normalization fallbacks\n" +
                                "4. Results cached per coordinate with a TTL\n\n" +
                                "## Status codes\n\n" +
                                "- `404` - the point lies outside every known constituency\n" +
                                "- `422` - missing, non-numeric or out-of-range coordinates\n" +
                                "- `500` - boundary data could not be evaluated\n" +
                                "- `503` - boundary data was not loaded")
                        .version("2.0.0")
                        .license(new License()
                                .name("MIT License")
                                .url("https://opensource.org/licenses/MIT")))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + serverPort)
                                .description("Local Development Server")
                ));
    }
}
