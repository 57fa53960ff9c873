package com.yieldvault;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class YieldVaultApplication {

    public static void main(String[] args) {
        SpringApplication.run(YieldVaultApplication.class, args);
    }
}
