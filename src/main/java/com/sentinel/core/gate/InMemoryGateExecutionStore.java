package com.sentinel.core.gate;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Non-durable {@link GateExecutionStore}; executions are kept in insertion order.
 */
public class InMemoryGateExecutionStore implements GateExecutionStore {

    private final List<GateExecution> executions = new CopyOnWriteArrayList<>();

    @Override
    public void save(GateExecution execution) {
        executions.add(execution);
    }

    @Override
    public Optional<GateExecution> findById(UUID id) {
        return executions.stream().filter(e -> e.id().equals(id)).findFirst();
    }

    @Override
    public List<GateExecution> findByExecutionId(String executionId) {
        return executions.stream().filter(e -> executionId.equals(e.executionId())).toList();
    }

    @Override
    public List<GateExecution> recent(int limit) {
        List<GateExecution> snapshot = new ArrayList<>(executions);
        List<GateExecution> latest = new ArrayList<>();
        for (int i = snapshot.size() - 1; i >= 0 && latest.size() < limit; i--) {
            latest.add(snapshot.get(i));
        }
        return latest;
    }
}
