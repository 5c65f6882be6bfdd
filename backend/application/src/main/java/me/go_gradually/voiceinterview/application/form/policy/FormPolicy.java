package me.go_gradually.voiceinterview.application.form.policy;

import java.time.Duration;

public interface FormPolicy {
    long maxAttachmentBytes();

    Duration validationDebounce();
}
