package me.go_gradually.voiceinterview.domain.form;

public record CandidateForm(String name,
                            String position,
                            String email,
                            Attachment jobDescription,
                            Attachment resume) {
    public CandidateForm {
        name = name == null ? "" : name;
        position = position == null ? "" : position;
        email = email == null ? "" : email;
    }

    public static CandidateForm empty() {
        return new CandidateForm("", "", "", null, null);
    }

    public CandidateForm withFields(String name, String position, String email) {
        return new CandidateForm(name, position, email, jobDescription, resume);
    }

    public CandidateForm withAttachment(AttachmentSlot slot, Attachment attachment) {
        if (slot == AttachmentSlot.JOB_DESCRIPTION) {
            return new CandidateForm(name, position, email, attachment, resume);
        }
        return new CandidateForm(name, position, email, jobDescription, attachment);
    }

    public Attachment attachment(AttachmentSlot slot) {
        return slot == AttachmentSlot.JOB_DESCRIPTION ? jobDescription : resume;
    }
}
