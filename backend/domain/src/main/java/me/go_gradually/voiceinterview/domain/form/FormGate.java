package me.go_gradually.voiceinterview.domain.form;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

public class FormGate {
    private static final Pattern EMAIL = Pattern.compile("^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$");

    private final long maxAttachmentBytes;

    public FormGate(long maxAttachmentBytes) {
        if (maxAttachmentBytes <= 0) {
            throw new IllegalArgumentException("maxAttachmentBytes must be positive");
        }
        this.maxAttachmentBytes = maxAttachmentBytes;
    }

    public FormValidation validate(CandidateForm form) {
        if (form == null) {
            return new FormValidation(false, List.of("form"));
        }
        List<String> problems = new ArrayList<>();
        if (form.name().trim().isEmpty()) {
            problems.add("name");
        }
        if (form.position().trim().isEmpty()) {
            problems.add("position");
        }
        if (!isEmail(form.email())) {
            problems.add("email");
        }
        checkAttachment(form.jobDescription(), AttachmentSlot.JOB_DESCRIPTION, problems);
        checkAttachment(form.resume(), AttachmentSlot.RESUME, problems);
        return new FormValidation(problems.isEmpty(), problems);
    }

    public boolean fitsSizeCeiling(Attachment attachment) {
        return attachment != null && attachment.sizeBytes() <= maxAttachmentBytes;
    }

    public String oversizeMessage(Attachment attachment) {
        long megabytes = maxAttachmentBytes / (1024 * 1024);
        return "File \"" + attachment.fileName() + "\" is too large. Maximum size is " + megabytes + "MB.";
    }

    public long maxAttachmentBytes() {
        return maxAttachmentBytes;
    }

    private void checkAttachment(Attachment attachment, AttachmentSlot slot, List<String> problems) {
        if (attachment == null || !fitsSizeCeiling(attachment)) {
            problems.add(slot.partName());
        }
    }

    private boolean isEmail(String email) {
        return email != null && EMAIL.matcher(email.trim()).matches();
    }
}
