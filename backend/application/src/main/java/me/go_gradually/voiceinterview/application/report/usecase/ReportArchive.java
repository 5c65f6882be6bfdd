package me.go_gradually.voiceinterview.application.report.usecase;

import me.go_gradually.voiceinterview.domain.report.ReportDocument;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

public class ReportArchive {
    private final AtomicReference<ReportDocument> latest = new AtomicReference<>();

    public void store(ReportDocument document) {
        latest.set(document);
    }

    public Optional<ReportDocument> latest() {
        return Optional.ofNullable(latest.get());
    }

    public void clear() {
        latest.set(null);
    }
}
