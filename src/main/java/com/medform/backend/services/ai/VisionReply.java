package com.medform.backend.services.ai;

/**
 * Raw model reply: the message text plus the token usage reported by the API (0 when absent).
 */
public record VisionReply(String text, long totalTokens, String model) {
}
