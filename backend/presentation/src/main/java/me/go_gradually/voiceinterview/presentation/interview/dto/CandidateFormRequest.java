package me.go_gradually.voiceinterview.presentation.interview.dto;

import jakarta.validation.constraints.Size;

public class CandidateFormRequest {
    @Size(max = 200)
    private String candidateName;
    @Size(max = 200)
    private String position;
    @Size(max = 320)
    private String email;

    public String getCandidateName() {
        return candidateName;
    }

    public void setCandidateName(String candidateName) {
        this.candidateName = candidateName;
    }

    public String getPosition() {
        return position;
    }

    public void setPosition(String position) {
        this.position = position;
    }

    public String getEmail() {
        return email;
    }

    public void setEmail(String email) {
        this.email = email;
    }
}
