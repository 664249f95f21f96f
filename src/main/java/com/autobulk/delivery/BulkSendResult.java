package com.autobulk.delivery;

/**
 * Outcome of a bulk send: the number of recipients a dispatch was attempted for.
 */
public record BulkSendResult(String templateId, int totalDispatched) {
}
