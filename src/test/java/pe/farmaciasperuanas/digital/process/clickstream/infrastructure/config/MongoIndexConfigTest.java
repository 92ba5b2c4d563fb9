package pe.farmaciasperuanas.digital.process.clickstream.infrastructure.config;

import org.junit.jupiter.api.Test;
import org.springframework.data.mongodb.core.ReactiveMongoTemplate;
import org.springframework.data.mongodb.core.index.Index;
import org.springframework.data.mongodb.core.index.IndexInfo;
import org.springframework.data.mongodb.core.index.ReactiveIndexOperations;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class MongoIndexConfigTest {

    @Test
    void createsOnlyMissingIndexes() {
        ReactiveMongoTemplate template = mock(ReactiveMongoTemplate.class);
        ReactiveIndexOperations indexOps = mock(ReactiveIndexOperations.class);
        IndexInfo existing = mock(IndexInfo.class);
        when(existing.getName()).thenReturn("session_browser_idx");
        when(template.indexOps(MongoIndexConfig.SESSIONS_COLLECTION)).thenReturn(indexOps);
        when(indexOps.getIndexInfo()).thenReturn(Flux.just(existing));
        when(indexOps.ensureIndex(any())).thenAnswer(i -> Mono.just("creado"));

        MongoIndexConfig config = new MongoIndexConfig(template);

        StepVerifier.create(config.createCollectionIndexes(
                        MongoIndexConfig.SESSIONS_COLLECTION, MongoIndexConfig.sessionIndexes()))
                .expectNext(6L)
                .verifyComplete();
        verify(indexOps, times(6)).ensureIndex(any());
        verify(indexOps, never()).ensureIndex(argThat(index ->
                "session_browser_idx".equals(((Index) index).getIndexOptions().get("name"))));
    }
}
