package me.go_gradually.voiceinterview.application.setup.port;

import me.go_gradually.voiceinterview.application.setup.model.AnalysisResult;
import me.go_gradually.voiceinterview.application.setup.model.QuestionsResult;
import me.go_gradually.voiceinterview.application.setup.model.SessionCreationCommand;
import me.go_gradually.voiceinterview.application.setup.model.SessionCreationResult;
import me.go_gradually.voiceinterview.application.setup.model.UploadResult;
import me.go_gradually.voiceinterview.domain.form.Attachment;

import java.util.concurrent.CompletableFuture;

/**
 * Backend setup calls. Explicit backend failures and non-2xx responses complete normally with
 * {@code success == false}; only transport problems complete exceptionally.
 */
public interface InterviewSetupPort {
    CompletableFuture<UploadResult> upload(Attachment jobDescription, Attachment resume);

    CompletableFuture<AnalysisResult> analyze(String jobDescriptionText, String resumeText);

    CompletableFuture<QuestionsResult> generateQuestions(String jobDescriptionText, String resumeText, int count);

    CompletableFuture<SessionCreationResult> createSession(SessionCreationCommand command);
}
