package com.flowys.flowys_backend.service;

import com.flowys.flowys_backend.model.domain.WorkflowNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Per-process balances. An owner's account is opened with the configured balance the first
 * time it is checked; deducting from an owner that was never checked fails.
 */
@Slf4j
@Component
public class InMemoryCreditLedger implements CreditLedger {

    private final long initialBalance;
    private final Map<String, AtomicLong> balances = new ConcurrentHashMap<>();

    public InMemoryCreditLedger(@Value("${flowys.credits.initial-balance:1000}") long initialBalance) {
        this.initialBalance = initialBalance;
    }

    @Override
    public CreditCheck hasEnoughCredits(String ownerId, List<WorkflowNode> nodes) {
        long required = CreditLedger.calculateCost(nodes);
        long remaining = balances.computeIfAbsent(ownerId, id -> {
            log.info("[Credits] Opening account for {} with {} credits", id, initialBalance);
            return new AtomicLong(initialBalance);
        }).get();
        return new CreditCheck(remaining >= required, required, remaining);
    }

    @Override
    public CreditDeduction deductCredits(String ownerId, long amount) {
        AtomicLong balance = balances.get(ownerId);
        if (balance == null) {
            return new CreditDeduction(false, 0, "Subscription not found");
        }
        while (true) {
            long current = balance.get();
            if (current < amount) {
                return new CreditDeduction(false, current, "Insufficient credits");
            }
            if (balance.compareAndSet(current, current - amount)) {
                return new CreditDeduction(true, current - amount, null);
            }
        }
    }
}
