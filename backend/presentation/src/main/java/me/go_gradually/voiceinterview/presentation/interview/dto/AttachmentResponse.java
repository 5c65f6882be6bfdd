package me.go_gradually.voiceinterview.presentation.interview.dto;

public class AttachmentResponse {
    private String slot;
    private String fileName;
    private long sizeBytes;
    private boolean accepted;

    public static AttachmentResponse of(String slot, String fileName, long sizeBytes, boolean accepted) {
        AttachmentResponse response = new AttachmentResponse();
        response.setSlot(slot);
        response.setFileName(fileName);
        response.setSizeBytes(sizeBytes);
        response.setAccepted(accepted);
        return response;
    }

    public String getSlot() {
        return slot;
    }

    public void setSlot(String slot) {
        this.slot = slot;
    }

    public String getFileName() {
        return fileName;
    }

    public void setFileName(String fileName) {
        this.fileName = fileName;
    }

    public long getSizeBytes() {
        return sizeBytes;
    }

    public void setSizeBytes(long sizeBytes) {
        this.sizeBytes = sizeBytes;
    }

    public boolean isAccepted() {
        return accepted;
    }

    public void setAccepted(boolean accepted) {
        this.accepted = accepted;
    }
}
