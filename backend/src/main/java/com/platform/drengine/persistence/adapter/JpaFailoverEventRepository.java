package com.platform.drengine.persistence.adapter;

import com.platform.drengine.failover.FailoverEvent;
import com.platform.drengine.failover.FailoverEventRepository;
import com.platform.drengine.failover.FailoverState;
import com.platform.drengine.persistence.EntityMappers;
import com.platform.drengine.persistence.repository.FailoverEventJpaRepository;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

@Component
public class JpaFailoverEventRepository implements FailoverEventRepository {
    
    private static final Set<FailoverState> TERMINAL = EnumSet.copyOf(
        Arrays.stream(FailoverState.values()).filter(FailoverState::isTerminal).toList());
    
    private final FailoverEventJpaRepository jpaRepository;
    private final EntityMappers mappers;
    
    public JpaFailoverEventRepository(FailoverEventJpaRepository jpaRepository, EntityMappers mappers) {
        this.jpaRepository = jpaRepository;
        this.mappers = mappers;
    }
    
    @Override
    @Transactional
    public FailoverEvent save(FailoverEvent event) {
        return mappers.toDomain(jpaRepository.save(mappers.toEntity(event)));
    }
    
    @Override
    @Transactional(readOnly = true)
    public Optional<FailoverEvent> findById(UUID id) {
        return jpaRepository.findById(id.toString()).map(mappers::toDomain);
    }
    
    @Override
    @Transactional(readOnly = true)
    public Optional<FailoverEvent> findActive(String primaryRegion) {
        return jpaRepository.findByPrimaryRegionAndStateNotInOrderByStartedAtDesc(primaryRegion, TERMINAL).stream()
            .findFirst()
            .map(mappers::toDomain);
    }
    
    @Override
    @Transactional(readOnly = true)
    public List<FailoverEvent> findNonTerminal() {
        return jpaRepository.findByStateNotIn(TERMINAL).stream().map(mappers::toDomain).toList();
    }
    
    @Override
    @Transactional(readOnly = true)
    public List<FailoverEvent> findByPrimaryRegion(String primaryRegion) {
        return jpaRepository.findByPrimaryRegionOrderByStartedAtDesc(primaryRegion).stream().map(mappers::toDomain).toList();
    }
    
    @Override
    @Transactional(readOnly = true)
    public List<FailoverEvent> findStartedBetween(Instant from, Instant to) {
        return jpaRepository.findByStartedAtGreaterThanEqualAndStartedAtBeforeOrderByStartedAtAsc(from, to).stream()
            .map(mappers::toDomain)
            .toList();
    }
}
