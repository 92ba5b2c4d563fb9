package pe.farmaciasperuanas.digital.process.clickstream.infrastructure.config.mongo;

import com.mongodb.reactivestreams.client.MongoClient;
import com.mongodb.reactivestreams.client.MongoClients;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.data.mongodb.core.ReactiveMongoTemplate;

@Configuration
@Slf4j
public class MongoConfig {

    @Value("${clickstream.mongodb.uri}")
    private String uri;

    @Value("${clickstream.mongodb.database}")
    private String database;

    @Bean
    @Primary
    public MongoClient reactiveMongoClient() {
        log.info("Inicializando cliente MongoDB para la base de datos {}", database);
        return MongoClients.create(uri);
    }

    @Bean(name = "reactiveMongoTemplate")
    @Primary
    public ReactiveMongoTemplate reactiveMongoTemplate(MongoClient reactiveMongoClient) {
        return new ReactiveMongoTemplate(reactiveMongoClient, database);
    }
}
