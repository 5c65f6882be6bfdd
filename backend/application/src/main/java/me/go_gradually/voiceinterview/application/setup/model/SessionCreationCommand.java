package me.go_gradually.voiceinterview.application.setup.model;

import java.util.List;
import java.util.Map;

public record SessionCreationCommand(String candidateName,
                                     String position,
                                     String email,
                                     List<String> questions,
                                     Map<String, Object> analysis,
                                     String jobDescriptionText,
                                     String resumeText) {
    public SessionCreationCommand {
        questions = questions == null ? List.of() : List.copyOf(questions);
        analysis = analysis == null ? Map.of() : analysis;
    }
}
