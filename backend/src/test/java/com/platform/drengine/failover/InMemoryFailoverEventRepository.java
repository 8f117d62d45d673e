package com.platform.drengine.failover;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryFailoverEventRepository implements FailoverEventRepository {

    private final Map<UUID, FailoverEvent> events = new ConcurrentHashMap<>();

    @Override
    public FailoverEvent save(FailoverEvent event) {
        FailoverEvent copy = copy(event);
        copy.setVersion(event.getVersion() == null ? 0L : event.getVersion() + 1);
        events.put(copy.getId(), copy);
        return copy(copy);
    }

    @Override
    public Optional<FailoverEvent> findById(UUID id) {
        return Optional.ofNullable(events.get(id)).map(InMemoryFailoverEventRepository::copy);
    }

    @Override
    public Optional<FailoverEvent> findActive(String primaryRegion) {
        return events.values().stream()
            .filter(e -> e.getPrimaryRegion().equals(primaryRegion) && !e.isTerminal())
            .findFirst()
            .map(InMemoryFailoverEventRepository::copy);
    }

    @Override
    public List<FailoverEvent> findNonTerminal() {
        return events.values().stream().filter(e -> !e.isTerminal()).map(InMemoryFailoverEventRepository::copy).toList();
    }

    @Override
    public List<FailoverEvent> findByPrimaryRegion(String primaryRegion) {
        return events.values().stream()
            .filter(e -> e.getPrimaryRegion().equals(primaryRegion))
            .sorted(Comparator.comparing(FailoverEvent::getStartedAt).reversed())
            .map(InMemoryFailoverEventRepository::copy)
            .toList();
    }

    @Override
    public List<FailoverEvent> findStartedBetween(Instant from, Instant to) {
        return events.values().stream()
            .filter(e -> !e.getStartedAt().isBefore(from) && e.getStartedAt().isBefore(to))
            .map(InMemoryFailoverEventRepository::copy)
            .toList();
    }

    private static FailoverEvent copy(FailoverEvent event) {
        return event.toBuilder().transitions(new ArrayList<>(event.getTransitions())).build();
    }
}
