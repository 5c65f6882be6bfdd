package me.go_gradually.voiceinterview.domain.report;

import me.go_gradually.voiceinterview.domain.session.SessionId;

public record ReportDocument(String fileName, String contentType, byte[] content) {
    public ReportDocument {
        if (fileName == null || fileName.isBlank()) {
            throw new IllegalArgumentException("Report file name is required");
        }
        contentType = contentType == null || contentType.isBlank() ? "application/pdf" : contentType;
        content = content == null ? new byte[0] : content;
    }

    public static ReportDocument forSession(SessionId sessionId, String contentType, byte[] content) {
        return new ReportDocument("interview_report_" + sessionId.shortValue() + ".pdf", contentType, content);
    }

    public int size() {
        return content.length;
    }
}
