package com.mirrortrader;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class MirrorTraderApplication {

    public static void main(String[] args) {
        SpringApplication.run(MirrorTraderApplication.class, args);
    }
}
