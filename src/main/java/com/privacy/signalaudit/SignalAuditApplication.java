package com.privacy.signalaudit;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SignalAuditApplication {

    public static void main(String[] args) {
        SpringApplication.run(SignalAuditApplication.class, args);
    }
}
