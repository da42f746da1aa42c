package com.deepsentinel.arb;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class DeepSentinelArbApplication {

    public static void main(String[] args) {
        SpringApplication.run(DeepSentinelArbApplication.class, args);
    }
}
