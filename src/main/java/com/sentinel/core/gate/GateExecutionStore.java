package com.sentinel.core.gate;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface GateExecutionStore {

    void save(GateExecution execution);

    Optional<GateExecution> findById(UUID id);

    List<GateExecution> findByExecutionId(String executionId);

    /**
     * Most recent executions, newest first.
     */
    List<GateExecution> recent(int limit);
}
