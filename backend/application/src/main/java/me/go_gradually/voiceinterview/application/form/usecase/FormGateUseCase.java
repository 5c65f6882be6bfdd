package me.go_gradually.voiceinterview.application.form.usecase;

import me.go_gradually.voiceinterview.application.form.policy.FormPolicy;
import me.go_gradually.voiceinterview.application.shared.port.EventLoop;
import me.go_gradually.voiceinterview.application.shared.port.ScheduledTask;
import me.go_gradually.voiceinterview.application.view.model.MessageArea;
import me.go_gradually.voiceinterview.application.view.model.MessageLevel;
import me.go_gradually.voiceinterview.application.view.usecase.InterviewView;
import me.go_gradually.voiceinterview.domain.form.Attachment;
import me.go_gradually.voiceinterview.domain.form.AttachmentSlot;
import me.go_gradually.voiceinterview.domain.form.CandidateForm;
import me.go_gradually.voiceinterview.domain.form.FormGate;
import me.go_gradually.voiceinterview.domain.form.FormValidation;

/**
 * Keeps the candidate's draft form. All methods run on the event loop.
 */
public class FormGateUseCase {
    private final FormGate gate;
    private final FormPolicy policy;
    private final EventLoop loop;
    private final InterviewView view;
    private CandidateForm form = CandidateForm.empty();
    private ScheduledTask pendingValidation;

    public FormGateUseCase(FormPolicy policy, EventLoop loop, InterviewView view) {
        this.gate = new FormGate(policy.maxAttachmentBytes());
        this.policy = policy;
        this.loop = loop;
        this.view = view;
    }

    public void updateFields(String name, String position, String email) {
        form = form.withFields(name, position, email);
        scheduleValidation();
    }

    public boolean attach(AttachmentSlot slot, Attachment attachment) {
        if (slot == null) {
            throw new IllegalArgumentException("Attachment slot is required");
        }
        if (attachment != null && !gate.fitsSizeCeiling(attachment)) {
            form = form.withAttachment(slot, null);
            view.showMessage(MessageArea.SETUP, MessageLevel.DANGER, gate.oversizeMessage(attachment));
            scheduleValidation();
            return false;
        }
        form = form.withAttachment(slot, attachment);
        scheduleValidation();
        return true;
    }

    public void detach(AttachmentSlot slot) {
        form = form.withAttachment(slot, null);
        scheduleValidation();
    }

    public FormValidation validateNow() {
        ScheduledTask.cancelIfPresent(pendingValidation);
        pendingValidation = null;
        FormValidation validation = gate.validate(form);
        view.formValidated(validation);
        return validation;
    }

    public CandidateForm currentForm() {
        return form;
    }

    public void reset() {
        ScheduledTask.cancelIfPresent(pendingValidation);
        pendingValidation = null;
        form = CandidateForm.empty();
        view.formValidated(gate.validate(form));
    }

    private void scheduleValidation() {
        ScheduledTask.cancelIfPresent(pendingValidation);
        pendingValidation = loop.schedule(this::validateNow, policy.validationDebounce());
    }
}
