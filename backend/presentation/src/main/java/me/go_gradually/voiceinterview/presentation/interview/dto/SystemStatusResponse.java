package me.go_gradually.voiceinterview.presentation.interview.dto;

public class SystemStatusResponse {
    private String level;

    public static SystemStatusResponse of(String level) {
        SystemStatusResponse response = new SystemStatusResponse();
        response.setLevel(level);
        return response;
    }

    public String getLevel() {
        return level;
    }

    public void setLevel(String level) {
        this.level = level;
    }
}
