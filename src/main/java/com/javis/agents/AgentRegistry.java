package com.javis.agents;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Holds the available agents. Read-mostly: lookups never lock, registration
 * copies the backing list. Knows nothing about tasks in flight.
 */
public class AgentRegistry {

    private static final Comparator<Registration> RANKING =
            Comparator.comparingInt(Registration::priority).reversed()
                    .thenComparingLong(Registration::order);

    private final List<Registration> registrations = new CopyOnWriteArrayList<>();
    private final AtomicLong order = new AtomicLong();

    public void register(Agent agent) {
        register(agent, 0);
    }

    /**
     * Adds an agent with a static routing priority; higher wins. Its capability
     * set is captured now and never re-read.
     *
     * @throws DuplicateAgentException if an agent with the same id is registered
     */
    public synchronized void register(Agent agent, int priority) {
        if (agent.id() == null || agent.id().isBlank()) {
            throw new IllegalArgumentException("agent id must not be empty");
        }
        if (get(agent.id()).isPresent()) {
            throw new DuplicateAgentException(agent.id());
        }
        var capabilities = Set.copyOf(agent.capabilities());
        registrations.add(new Registration(agent, capabilities, priority, order.getAndIncrement()));
    }

    /**
     * Agents able to run {@code taskType}, best first: priority descending, then
     * registration order.
     *
     * @param capabilityName restricts matches to that capability; null means any
     */
    public List<Agent> find(String capabilityName, String taskType) {
        return registrations.stream()
                .filter(r -> r.canRun(capabilityName, taskType))
                .sorted(RANKING)
                .map(Registration::agent)
                .toList();
    }

    public Optional<Agent> get(String id) {
        return registrations.stream()
                .filter(r -> r.agent().id().equals(id))
                .map(Registration::agent)
                .findFirst();
    }

    /** Capabilities as captured at registration. */
    public Set<Capability> capabilitiesOf(String id) {
        return registrations.stream()
                .filter(r -> r.agent().id().equals(id))
                .map(Registration::capabilities)
                .findFirst()
                .orElse(Set.of());
    }

    public List<Agent> all() {
        return registrations.stream().map(Registration::agent).toList();
    }

    public int size() {
        return registrations.size();
    }

    private record Registration(Agent agent, Set<Capability> capabilities, int priority, long order) {
        boolean canRun(String capabilityName, String taskType) {
            return capabilities.stream()
                    .filter(c -> capabilityName == null || c.name().equals(capabilityName))
                    .anyMatch(c -> c.accepts(taskType));
        }
    }
}
