package com.lynkvertx.navarch.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.tags.Tag;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI (Swagger) Configuration
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI navarchOpenAPI() {
        return new OpenAPI()
            .info(new Info()
                .title("NAVARCH API")
                .description("Hull geometry, hydrostatic tables, trim equilibrium and intact stability. "
                    + "Lengths in metres, angles in degrees, displacement in kg.")
                .version("0.1.0")
                .contact(new Contact()
                    .name("NAVARCH Team")
                    .email("support@lynkvertx.com"))
                .license(new License()
                    .name("Proprietary")))
            .tags(List.of(
                new Tag().name("Hydrostatics").description("Upright, trimmed and heeled hydrostatics"),
                new Tag().name("Stability").description("Righting arm curves and criteria")));
    }
}
