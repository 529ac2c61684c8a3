package com.clapgrow.reminder.api.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import io.swagger.v3.oas.models.Components;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    private static final String CRON_KEY_SCHEME = "cronKey";

    @Bean
    public OpenAPI reminderApiOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Reminder API")
                        .description("Tick-driven reminder delivery. An external scheduler calls /cron/tick; " +
                                "each tick claims due reminders, sends them through Telegram and reschedules them.")
                        .version("1.0.0"))
                .components(new Components()
                        .addSecuritySchemes(CRON_KEY_SCHEME, new SecurityScheme()
                                .type(SecurityScheme.Type.APIKEY)
                                .in(SecurityScheme.In.HEADER)
                                .name("X-Cron-Key")))
                .addSecurityItem(new SecurityRequirement().addList(CRON_KEY_SCHEME));
    }
}
