package com.chronicle.orchestration;

import com.chronicle.extractor.BatchAttempt;
import com.chronicle.extractor.BatchCapable;
import com.chronicle.extractor.ErrorKind;
import com.chronicle.extractor.ExtractionRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * First stage of batch-with-fallback: one batched call for all targets. Any
 * outcome other than {@link BatchAttempt.Success} sends the orchestrator to the
 * per-target path.
 */
public class BatchFallbackStrategy {

    private static final Logger log = LoggerFactory.getLogger(BatchFallbackStrategy.class);

    public BatchAttempt tryBatch(BatchCapable extractor, ExtractionRequest request, List<String> targets) {
        String unit = extractor.name() + ":batch";
        try {
            BatchAttempt attempt = extractor.runBatch(request, targets);
            if (attempt instanceof BatchAttempt.Failed failed) {
                log.warn("{} failed ({}), falling back to {} individual calls", unit, failed.reason(), targets.size());
            } else if (attempt instanceof BatchAttempt.NotApplicable notApplicable) {
                log.debug("{} not applicable: {}", unit, notApplicable.reason());
            }
            return attempt;
        } catch (RuntimeException ex) {
            log.error("{} threw, falling back to {} individual calls", unit, targets.size(), ex);
            request.diagnostics().report(unit, ErrorKind.EXTRACTOR_EXCEPTION, describe(ex));
            return new BatchAttempt.Failed(describe(ex));
        }
    }

    static String describe(Throwable ex) {
        return ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
    }
}
