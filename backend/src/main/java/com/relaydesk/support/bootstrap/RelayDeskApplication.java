package com.relaydesk.support.bootstrap;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "com.relaydesk.support")
public class RelayDeskApplication {
    public static void main(String[] args) {
        SpringApplication.run(RelayDeskApplication.class, args);
    }
}
