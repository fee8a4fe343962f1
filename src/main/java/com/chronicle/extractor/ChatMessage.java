package com.chronicle.extractor;

/**
 * One message of the transcript, as the host chat shows it.
 */
public record ChatMessage(int messageId, String name, boolean user, String text) {
}
