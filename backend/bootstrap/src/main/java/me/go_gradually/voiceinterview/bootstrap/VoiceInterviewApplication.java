package me.go_gradually.voiceinterview.bootstrap;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "me.go_gradually.voiceinterview")
public class VoiceInterviewApplication {
    public static void main(String[] args) {
        SpringApplication.run(VoiceInterviewApplication.class, args);
    }
}
