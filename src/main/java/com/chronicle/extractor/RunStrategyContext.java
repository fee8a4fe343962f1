package com.chronicle.extractor;

/**
 * Input to {@link RunStrategy#shouldFire}: the turn plus the extractor's own history.
 */
public record RunStrategyContext(ExtractionRequest request, ExtractorState state) {

    public int messageId() {
        return request.currentMessage().messageId();
    }
}
