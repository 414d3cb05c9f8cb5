package com.flowys.flowys_backend.service;

import com.flowys.flowys_backend.model.domain.WorkflowNode;

import java.util.List;

/**
 * Metering boundary. Runs are checked before they start and charged after they finish,
 * whatever the outcome. Implementations must make both operations atomic per owner.
 */
public interface CreditLedger {

    record CreditCheck(boolean hasCredits, long required, long remaining) {}

    record CreditDeduction(boolean success, long remaining, String error) {}

    CreditCheck hasEnoughCredits(String ownerId, List<WorkflowNode> nodes);

    CreditDeduction deductCredits(String ownerId, long amount);

    /** Sum of the per-type cost of every node; nodes without a type cost nothing. */
    static long calculateCost(List<WorkflowNode> nodes) {
        return nodes.stream()
                .filter(n -> n != null && n.getType() != null)
                .mapToLong(n -> n.getType().getCreditCost())
                .sum();
    }
}
