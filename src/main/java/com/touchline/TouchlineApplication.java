package com.touchline;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@EnableAsync
public class TouchlineApplication {

    public static void main(String[] args) {
        SpringApplication.run(TouchlineApplication.class, args);
    }
}
