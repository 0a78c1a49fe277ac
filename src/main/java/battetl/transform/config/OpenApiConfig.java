package battetl.transform.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI/Swagger configuration for the transform API
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI transformOpenAPI(@Value("${server.port:8080}") int port) {
        Server localServer = new Server();
        localServer.setUrl("http://localhost:" + port);
        localServer.setDescription("Local Development Server");

        Info info = new Info()
                .title("Battery Cycler Transform API")
                .version("1.0.0")
                .description("Normalizes Arbin and Maccor cycler exports to a canonical schema "
                        + "and calculates per-cycle charge/discharge statistics")
                .license(new License().name("MIT License").url("https://opensource.org/licenses/MIT"));

        return new OpenAPI()
                .info(info)
                .servers(List.of(localServer));
    }
}
