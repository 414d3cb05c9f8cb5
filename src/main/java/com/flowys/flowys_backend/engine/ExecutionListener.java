package com.flowys.flowys_backend.engine;

import com.flowys.flowys_backend.model.execution.ExecutionLog;

import java.util.List;

/**
 * Progress hook called on the executing thread after each node status change
 * (running, then completed or failed). Exceptions it throws are logged and ignored.
 */
@FunctionalInterface
public interface ExecutionListener {

    ExecutionListener NONE = (log, logs) -> { };

    void onNodeUpdate(ExecutionLog log, List<ExecutionLog> logs);
}
