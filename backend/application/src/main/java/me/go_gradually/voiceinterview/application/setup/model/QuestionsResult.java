package me.go_gradually.voiceinterview.application.setup.model;

import java.util.List;

public record QuestionsResult(boolean success, List<String> questions, String error) implements StepResult {
    public QuestionsResult {
        questions = questions == null ? List.of() : List.copyOf(questions);
    }

    public static QuestionsResult succeeded(List<String> questions) {
        return new QuestionsResult(true, questions, null);
    }

    public static QuestionsResult failed(String error) {
        return new QuestionsResult(false, null, error);
    }
}
