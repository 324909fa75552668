package me.go_gradually.callflow.bootstrap;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "me.go_gradually.callflow")
public class CallflowApplication {
    public static void main(String[] args) {
        SpringApplication.run(CallflowApplication.class, args);
    }
}
