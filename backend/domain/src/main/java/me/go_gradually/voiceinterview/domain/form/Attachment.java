package me.go_gradually.voiceinterview.domain.form;

public record Attachment(String fileName, long sizeBytes, String contentType, byte[] content) {
    public Attachment {
        if (fileName == null || fileName.isBlank()) {
            throw new IllegalArgumentException("File name is required");
        }
        if (sizeBytes < 0) {
            throw new IllegalArgumentException("File size must not be negative");
        }
        contentType = contentType == null || contentType.isBlank() ? "application/octet-stream" : contentType;
        content = content == null ? new byte[0] : content;
    }

    public static Attachment of(String fileName, String contentType, byte[] content) {
        byte[] bytes = content == null ? new byte[0] : content;
        return new Attachment(fileName, bytes.length, contentType, bytes);
    }
}
