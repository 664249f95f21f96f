package com.autobulk.delivery;

public record RenderedMessage(String templateId, String subject, String body) {
}
