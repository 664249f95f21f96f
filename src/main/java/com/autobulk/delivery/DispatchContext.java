package com.autobulk.delivery;

import java.util.UUID;

/**
 * Identifies the attempt on whose behalf a collaborator is called.
 */
public record DispatchContext(UUID jobId, UUID executionId, int attemptNumber) {
}
