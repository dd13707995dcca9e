package com.claimsledger.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

    private static final String SECURITY_SCHEME_NAME = "bearerAuth";

    @Bean
    public OpenAPI claimsLedgerOpenAPI(@Value("${claimsledger.api.server-url:http://localhost:8080/api}") String serverUrl) {
        Server server = new Server();
        server.setUrl(serverUrl);
        server.setDescription("Claims Ledger API");

        Contact contact = new Contact();
        contact.setName("Claims Ledger Team");
        contact.setEmail("claims-ledger@claimsledger.local");

        Info info = new Info()
                .title("Claims Ledger API")
                .version("1.0.0")
                .description("Claim liability decisions and append-only claim ledgers, " +
                             "aggregated at 100% and at participation share")
                .contact(contact);

        return new OpenAPI()
                .info(info)
                .servers(List.of(server))
                .addSecurityItem(new SecurityRequirement().addList(SECURITY_SCHEME_NAME))
                .components(new Components()
                        .addSecuritySchemes(SECURITY_SCHEME_NAME,
                                new SecurityScheme()
                                        .name(SECURITY_SCHEME_NAME)
                                        .type(SecurityScheme.Type.HTTP)
                                        .scheme("bearer")
                                        .bearerFormat("JWT")
                        )
                );
    }
}
