package tech.noetzold.trust_engine_api.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import io.swagger.v3.oas.models.tags.Tag;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class SwaggerConfig {

    @Bean
    public OpenAPI trustEngineOpenAPI(@Value("${server.port:8090}") int port) {
        return new OpenAPI()
                .info(new Info()
                        .title("Trust Engine API")
                        .version("1.0.0")
                        .description("Control normalization across compliance frameworks, evidence coverage "
                                + "scoring and risk weighted stakeholder routing")
                        .contact(new Contact()
                                .name("Noetzold Tech")
                                .email("contato@noetzold.tech")
                                .url("https://noetzold.tech"))
                        .license(new License()
                                .name("Apache 2.0")
                                .url("https://www.apache.org/licenses/LICENSE-2.0.html")))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + port)
                                .description("Development")))
                .tags(List.of(
                        new Tag().name("Catalog").description("Control import and canonical clusters"),
                        new Tag().name("Evidence").description("Evidence ledger and status transitions"),
                        new Tag().name("Trust score").description("Coverage and per framework scores"),
                        new Tag().name("Risk").description("Impact estimates and remediation priority"),
                        new Tag().name("Routing").description("Findings, decisions, thresholds and SLA breaches")));
    }
}
