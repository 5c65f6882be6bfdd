package me.go_gradually.voiceinterview.application.setup.model;

import me.go_gradually.voiceinterview.domain.setup.SetupStep;

public class SetupStepException extends RuntimeException {
    private final SetupStep step;
    private final boolean timedOut;

    public SetupStepException(SetupStep step, String message, boolean timedOut) {
        super(message);
        this.step = step;
        this.timedOut = timedOut;
    }

    public SetupStep step() {
        return step;
    }

    public boolean timedOut() {
        return timedOut;
    }
}
