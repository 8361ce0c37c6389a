package com.datcoord.aggregation;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.datcoord.core.CoordinationException;
import com.datcoord.core.ErrorCode;
import com.datcoord.core.Identity;
import com.datcoord.gradient.GradientSubmission;
import com.datcoord.gradient.PendingGradientLedger;
import com.datcoord.store.ContentId;
import com.datcoord.store.ContentNotFoundException;
import com.datcoord.store.ContentStore;

public class FederatedAveragingJob {
    private static final Logger log = LoggerFactory.getLogger(FederatedAveragingJob.class);

    private final ContentStore contentStore;
    private final PendingGradientLedger pending;
    private final AggregationEngine engine;

    public FederatedAveragingJob(ContentStore contentStore, PendingGradientLedger pending, AggregationEngine engine) {
        this.contentStore = contentStore;
        this.pending = pending;
        this.engine = engine;
    }

    public AggregationReport run(long modelVersion, Identity caller) {
        engine.checkFinalizable(modelVersion, caller);
        List<GradientSubmission> snapshot = pending.listPending(modelVersion);
        if (snapshot.isEmpty()) {
            throw new CoordinationException(ErrorCode.INVALID_GRADIENT,
                    "version " + modelVersion + " has no pending gradients");
        }

        List<GradientDocument> documents = new ArrayList<>();
        List<ContentId> skipped = new ArrayList<>();
        for (GradientSubmission submission : snapshot) {
            GradientDocument document = load(submission);
            if (document == null) {
                skipped.add(submission.gradientRef());
            } else {
                documents.add(document);
            }
        }
        if (documents.isEmpty()) {
            throw new CoordinationException(ErrorCode.INVALID_GRADIENT,
                    "none of the " + snapshot.size() + " pending gradients of version " + modelVersion + " is usable");
        }

        GradientDocument averaged = FederatedAverager.average(documents);
        ContentId newWeightsRef = contentStore.put(GradientDocuments.write(averaged));
        log.info("aggregation.averaged version={} used={} skipped={} weightsRef={}",
                modelVersion, documents.size(), skipped.size(), newWeightsRef);

        FinalizeResult result = engine.finalize(modelVersion, newWeightsRef, caller);
        return new AggregationReport(result, documents.size(), List.copyOf(skipped));
    }

    private GradientDocument load(GradientSubmission submission) {
        byte[] bytes;
        try {
            bytes = contentStore.get(submission.gradientRef());
        } catch (ContentNotFoundException e) {
            log.warn("aggregation.skip reason=not_found ref={} contributor={}",
                    submission.gradientRef(), submission.contributor());
            return null;
        }
        try {
            GradientDocument document = GradientDocuments.read(bytes);
            if (FederatedAverager.isUsable(document)) {
                return document;
            }
            log.warn("aggregation.skip reason=unsupported_document ref={} contributor={}",
                    submission.gradientRef(), submission.contributor());
        } catch (IOException e) {
            log.warn("aggregation.skip reason=undecodable ref={} contributor={} error={}",
                    submission.gradientRef(), submission.contributor(), e.getMessage());
        }
        return null;
    }
}
