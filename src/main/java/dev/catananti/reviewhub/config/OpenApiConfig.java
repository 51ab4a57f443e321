package dev.catananti.reviewhub.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration(proxyBeanMethods = false)
public class OpenApiConfig {

    @Value("${app.version:1.0.0}")
    private String appVersion;

    @Value("${server.port:8080}")
    private String serverPort;

    @Bean
    public OpenAPI customOpenAPI() {
        final String securitySchemeName = "bearerAuth";

        return new OpenAPI()
                .info(new Info()
                        .title("Blog Review Hub API")
                        .description("""
                                Review workflow and real-time distribution for blog posts.

                                ## Features
                                - Draft, submit, approve, reject and resubmit posts
                                - Server-Sent Events stream of workflow events for reviewers
                                - Live comment rooms over WebSocket (`/ws/posts/{postId}/comments?token=...`)

                                ## Authentication
                                Endpoints require a JWT in the Authorization header:
                                `Authorization: Bearer <token>`
                                """)
                        .version(appVersion))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + serverPort)
                                .description("Development Server")))
                .addSecurityItem(new SecurityRequirement().addList(securitySchemeName))
                .components(new Components()
                        .addSecuritySchemes(securitySchemeName,
                                new SecurityScheme()
                                        .name(securitySchemeName)
                                        .type(SecurityScheme.Type.HTTP)
                                        .scheme("bearer")
                                        .bearerFormat("JWT")
                                        .description("JWT whose subject is the user id and whose role claim is USER, ADMIN or L1_APPROVER")));
    }
}
