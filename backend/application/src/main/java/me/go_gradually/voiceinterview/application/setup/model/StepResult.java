package me.go_gradually.voiceinterview.application.setup.model;

public interface StepResult {
    boolean success();

    String error();
}
