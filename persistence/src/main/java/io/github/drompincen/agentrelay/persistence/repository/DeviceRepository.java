package io.github.drompincen.agentrelay.persistence.repository;

import io.github.drompincen.agentrelay.persistence.document.DeviceDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface DeviceRepository extends MongoRepository<DeviceDocument, String> {
    List<DeviceDocument> findAllByOrderByCreatedAtAscDeviceIdAsc();
}
