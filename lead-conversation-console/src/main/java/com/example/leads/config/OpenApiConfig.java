package com.example.leads.config;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Contact;
import io.swagger.v3.oas.annotations.info.Info;
import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@OpenAPIDefinition(
        info =
                @Info(
                        title = "Lead Conversation Console API",
                        version = "1.0",
                        description = "Merged lead listing, cascading lead removal and hand-off control of "
                                + "conversations. Live lead views and countdown ticks are served over Socket.IO.",
                        contact = @Contact(name = "Lead Console Team", email = "leads@example.com")))
public class OpenApiConfig {

    @Bean
    public GroupedOpenApi leadListApi() {
        return GroupedOpenApi.builder()
                .group("leads")
                .pathsToMatch("/api/organizations/*/leads/**")
                .build();
    }

    @Bean
    public GroupedOpenApi handOffApi() {
        return GroupedOpenApi.builder()
                .group("conversations")
                .pathsToMatch("/api/conversations/**")
                .build();
    }
}
