package com.chronicle.orchestration;

import com.chronicle.extractor.ExtractionPhase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Progress callbacks for status displays. Called from the orchestrator thread
 * and from fan-out workers.
 */
public interface ExtractionProgress {

    void sectionStarted(ExtractionPhase phase);

    void sectionCompleted(ExtractionPhase phase);

    void label(String label);

    static ExtractionProgress logging() {
        return LoggingProgress.INSTANCE;
    }

    final class LoggingProgress implements ExtractionProgress {
        private static final Logger log = LoggerFactory.getLogger(LoggingProgress.class);
        private static final LoggingProgress INSTANCE = new LoggingProgress();

        @Override
        public void sectionStarted(ExtractionPhase phase) {
            log.debug("{}", phase.label());
        }

        @Override
        public void sectionCompleted(ExtractionPhase phase) {
            log.debug("{} done", phase);
        }

        @Override
        public void label(String label) {
            log.debug("{}", label);
        }
    }
}
