package com.platform.drengine.replication;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface ReplicationLinkRepository {

    ReplicationLink save(ReplicationLink link);

    Optional<ReplicationLink> findById(UUID id);

    Optional<ReplicationLink> findByPair(String primaryRegion, String replicaRegion);

    List<ReplicationLink> findByPrimaryRegion(String primaryRegion);

    List<ReplicationLink> findAll();
}
