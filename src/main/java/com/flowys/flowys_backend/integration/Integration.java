package com.flowys.flowys_backend.integration;

import java.util.Optional;

/**
 * A third-party service that Integration nodes can call. Implementations are Spring beans
 * and are picked up by {@link IntegrationRegistry}.
 */
public interface Integration {

    IntegrationDefinition definition();

    /**
     * Runs one action against the service. Expected failures (bad input, a rejected call)
     * come back as {@link ActionResult#failure}; only unexpected errors are thrown.
     */
    ActionResult executeAction(String actionId, ActionContext context);

    default Optional<IntegrationAction> findAction(String actionId) {
        return definition().actions().stream()
                .filter(a -> a.id().equals(actionId))
                .findFirst();
    }
}
