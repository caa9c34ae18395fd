package com.foursite.growth.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * OpenAPI/Swagger configuration
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI growthOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("4site Growth API")
                        .description(
                                "API for the viral growth engine - share tracking, viral scores, auto-featuring, showcase ranking, referral commissions and milestones")
                        .version("1.0.0")
                        .contact(new Contact()
                                .name("4site Team")
                                .url("https://4site.pro"))
                        .license(new License()
                                .name("MIT License")
                                .url("https://opensource.org/licenses/MIT")));
    }
}
