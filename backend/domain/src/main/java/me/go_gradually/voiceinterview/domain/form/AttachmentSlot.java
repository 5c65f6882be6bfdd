package me.go_gradually.voiceinterview.domain.form;

import java.util.Locale;

public enum AttachmentSlot {
    JOB_DESCRIPTION("jd_file"),
    RESUME("resume_file");

    private final String partName;

    AttachmentSlot(String partName) {
        this.partName = partName;
    }

    public String partName() {
        return partName;
    }

    public static AttachmentSlot fromPath(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Attachment slot is required");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        return switch (normalized) {
            case "job-description", "jd", "jd-file" -> JOB_DESCRIPTION;
            case "resume", "resume-file" -> RESUME;
            default -> throw new IllegalArgumentException("Unknown attachment slot: " + value);
        };
    }
}
