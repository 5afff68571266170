package com.relayclaw.gateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "com.relayclaw.gateway")
public class RelayClawApp {

    public static void main(String[] args) {
        SpringApplication.run(RelayClawApp.class, args);
    }
}
