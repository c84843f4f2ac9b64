package co.fanki.faex.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI/Swagger configuration for the faex server.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Configuration
public class OpenApiConfiguration {

    @Value("${server.port:8080}")
    private int serverPort;

    @Value("${faex.analysis.max-depth:3}")
    private int defaultMaxDepth;

    /**
     * Configures the OpenAPI specification.
     *
     * @return the OpenAPI configuration
     */
    @Bean
    public OpenAPI openAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("faex API")
                        .description("""
                                faex - checks that every FastAPI endpoint declares, in the
                                `exceptions=[...]` argument of its route decorator, each
                                exception its body can raise directly or through the
                                functions it calls.

                                ## Operations
                                - `POST /api/analysis/check` - JSON report of every endpoint
                                - `POST /api/analysis/suggest` - suggested declarations

                                Calls are followed %d levels deep unless `maxDepth` is given.

                                ## MCP Tools
                                - `check_endpoint_exceptions` - Check a file or directory
                                - `suggest_exception_declarations` - Suggest declarations
                                """.formatted(defaultMaxDepth))
                        .version("0.1.0")
                        .license(new License()
                                .name("MIT")))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + serverPort)
                                .description("Local development server")));
    }

}
