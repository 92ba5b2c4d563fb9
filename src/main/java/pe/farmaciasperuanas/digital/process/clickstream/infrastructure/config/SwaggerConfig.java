package pe.farmaciasperuanas.digital.process.clickstream.infrastructure.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Documentación OpenAPI de los endpoints de métricas de clickstream.
 */
@Configuration
public class SwaggerConfig {

    @Value("${spring.application.name:clickstream-process}")
    private String applicationName;

    @Bean
    public OpenAPI customOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Clickstream Process API (" + applicationName + ")")
                        .description(
                                "API de métricas de comportamiento de compradores en línea." +
                                        "\n\n**Características principales:**" +
                                        "\n- Conversión por navegador, sistema operativo, región, tráfico y mes" +
                                        "\n- Impacto de engagement y rendimiento por tipo de página" +
                                        "\n- Cohortes fijas y resumen ejecutivo" +
                                        "\n- Filtros combinables y opciones de filtro disponibles"
                        )
                        .version("1.0.0")
                        .contact(new Contact()
                                .name("Equipo de Analítica Digital")
                                .email("analytics-team@farmaciasperuanas.pe")
                                .url("https://www.farmaciasperuanas.pe"))
                        .license(new License()
                                .name("Propietario")
                                .url("https://www.farmaciasperuanas.pe"))
                )
                .servers(List.of(
                        new Server()
                                .url("/")
                                .description("Servidor actual")
                ));
    }
}
