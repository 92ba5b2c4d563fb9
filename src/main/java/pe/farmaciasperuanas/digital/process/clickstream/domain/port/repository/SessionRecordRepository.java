package pe.farmaciasperuanas.digital.process.clickstream.domain.port.repository;

import org.springframework.data.mongodb.repository.ReactiveMongoRepository;
import org.springframework.stereotype.Repository;
import pe.farmaciasperuanas.digital.process.clickstream.domain.entity.SessionRecord;

@Repository
public interface SessionRecordRepository extends ReactiveMongoRepository<SessionRecord, String> {
}
