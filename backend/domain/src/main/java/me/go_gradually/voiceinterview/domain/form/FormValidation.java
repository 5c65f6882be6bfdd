package me.go_gradually.voiceinterview.domain.form;

import java.util.List;

public record FormValidation(boolean valid, List<String> problems) {
    public static final String READY_HINT = "Start Interview Setup";
    public static final String INCOMPLETE_HINT = "Please complete all fields";

    public FormValidation {
        problems = problems == null ? List.of() : List.copyOf(problems);
    }

    public String submitHint() {
        return valid ? READY_HINT : INCOMPLETE_HINT;
    }
}
