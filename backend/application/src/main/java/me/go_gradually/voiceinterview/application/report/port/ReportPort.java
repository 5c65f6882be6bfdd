package me.go_gradually.voiceinterview.application.report.port;

import me.go_gradually.voiceinterview.application.report.model.ReportDispatchResult;
import me.go_gradually.voiceinterview.domain.report.ReportDocument;
import me.go_gradually.voiceinterview.domain.session.SessionId;

import java.util.concurrent.CompletableFuture;

public interface ReportPort {
    /**
     * Completes exceptionally only when the report service cannot be reached.
     */
    CompletableFuture<ReportDispatchResult> sendReport(SessionId sessionId);

    CompletableFuture<ReportDocument> downloadReport(SessionId sessionId);
}
