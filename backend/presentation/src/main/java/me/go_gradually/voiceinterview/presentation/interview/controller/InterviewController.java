package me.go_gradually.voiceinterview.presentation.interview.controller;

import jakarta.validation.Valid;
import me.go_gradually.voiceinterview.application.connection.model.InterviewSnapshot;
import me.go_gradually.voiceinterview.application.console.usecase.InterviewConsoleUseCase;
import me.go_gradually.voiceinterview.application.view.model.InterviewEventSink;
import me.go_gradually.voiceinterview.domain.form.Attachment;
import me.go_gradually.voiceinterview.domain.form.AttachmentSlot;
import me.go_gradually.voiceinterview.domain.report.ReportDocument;
import me.go_gradually.voiceinterview.domain.session.SessionDescriptor;
import me.go_gradually.voiceinterview.presentation.interview.dto.AttachmentResponse;
import me.go_gradually.voiceinterview.presentation.interview.dto.CandidateFormRequest;
import me.go_gradually.voiceinterview.presentation.interview.dto.InterviewStateResponse;
import me.go_gradually.voiceinterview.presentation.interview.dto.SetupResponse;
import me.go_gradually.voiceinterview.presentation.interview.dto.SystemStatusResponse;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

@RestController
@RequestMapping("/api/interview")
public class InterviewController {
    private final InterviewConsoleUseCase consoleUseCase;

    public InterviewController(InterviewConsoleUseCase consoleUseCase) {
        this.consoleUseCase = consoleUseCase;
    }

    @GetMapping(value = "/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter events() {
        SseEmitter emitter = new SseEmitter(Duration.ofMinutes(30).toMillis());
        AtomicBoolean open = new AtomicBoolean(true);
        InterviewEventSink sink = toSink(emitter, open);
        emitter.onCompletion(() -> closeSink(open, sink));
        emitter.onTimeout(() -> closeSink(open, sink));
        consoleUseCase.subscribe(sink);
        return emitter;
    }

    @PutMapping("/form")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public void updateForm(@Valid @RequestBody CandidateFormRequest request) {
        consoleUseCase.updateForm(request.getCandidateName(), request.getPosition(), request.getEmail());
    }

    @PostMapping(value = "/attachments/{slot}", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public CompletableFuture<AttachmentResponse> attach(@PathVariable("slot") String slot,
                                                        @RequestParam("file") MultipartFile file) {
        AttachmentSlot attachmentSlot = AttachmentSlot.fromPath(slot);
        Attachment attachment = toAttachment(file);
        return consoleUseCase.attach(attachmentSlot, attachment)
                .thenApply(accepted -> AttachmentResponse.of(attachmentSlot.partName(),
                        attachment.fileName(), attachment.sizeBytes(), accepted));
    }

    @DeleteMapping("/attachments/{slot}")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public void detach(@PathVariable("slot") String slot) {
        consoleUseCase.detach(AttachmentSlot.fromPath(slot));
    }

    @PostMapping("/setup")
    public CompletableFuture<SetupResponse> setup() {
        return consoleUseCase.startSetup().thenApply(this::toSetupResponse);
    }

    @PostMapping("/connect")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public void connect() {
        consoleUseCase.connect();
    }

    @PostMapping("/disconnect")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public void disconnect() {
        consoleUseCase.disconnect();
    }

    @PostMapping("/reset")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public void reset() {
        consoleUseCase.startNewInterview();
    }

    @PostMapping("/system-status")
    public CompletableFuture<SystemStatusResponse> systemStatus() {
        return consoleUseCase.checkSystemStatus().thenApply(level -> SystemStatusResponse.of(level.code()));
    }

    @GetMapping("/state")
    public CompletableFuture<InterviewStateResponse> state() {
        return consoleUseCase.snapshot().thenApply(this::toStateResponse);
    }

    @GetMapping("/report")
    public CompletableFuture<ResponseEntity<byte[]>> report() {
        CompletableFuture<ReportDocument> document = consoleUseCase.latestReport()
                .map(CompletableFuture::completedFuture)
                .orElseGet(consoleUseCase::downloadReport);
        return document.thenApply(this::toDownload);
    }

    private InterviewEventSink toSink(SseEmitter emitter, AtomicBoolean open) {
        return (event, payload) -> {
            if (!open.get()) {
                return false;
            }
            try {
                emitter.send(SseEmitter.event().name(event).data(payload));
                return true;
            } catch (IOException | IllegalStateException e) {
                open.set(false);
                emitter.completeWithError(e);
                return false;
            }
        };
    }

    private void closeSink(AtomicBoolean open, InterviewEventSink sink) {
        open.set(false);
        consoleUseCase.unsubscribe(sink);
    }

    private Attachment toAttachment(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new IllegalArgumentException("Attachment file is required");
        }
        String fileName = file.getOriginalFilename() == null || file.getOriginalFilename().isBlank()
                ? file.getName()
                : file.getOriginalFilename();
        try {
            return new Attachment(fileName, file.getSize(), file.getContentType(), file.getBytes());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read upload", e);
        }
    }

    private SetupResponse toSetupResponse(SessionDescriptor descriptor) {
        SetupResponse response = new SetupResponse();
        response.setSessionId(descriptor.sessionId().value());
        response.setRoomName(descriptor.roomName());
        response.setQuestions(descriptor.questions());
        return response;
    }

    private InterviewStateResponse toStateResponse(InterviewSnapshot snapshot) {
        InterviewStateResponse response = new InterviewStateResponse();
        response.setConnectionState(snapshot.state().code());
        response.setSessionId(snapshot.currentDescriptor().map(descriptor -> descriptor.sessionId().value()).orElse(null));
        response.setSessionStatus(snapshot.sessionStatus() == null ? null : snapshot.sessionStatus().code());
        response.setConnectionAttempts(snapshot.connectionAttempts());
        response.setReconciling(snapshot.reconciling());
        response.setReportAvailable(consoleUseCase.latestReport().isPresent());
        return response;
    }

    private ResponseEntity<byte[]> toDownload(ReportDocument document) {
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION,
                        ContentDisposition.attachment().filename(document.fileName()).build().toString())
                .contentType(MediaType.parseMediaType(document.contentType()))
                .contentLength(document.size())
                .body(document.content());
    }
}
