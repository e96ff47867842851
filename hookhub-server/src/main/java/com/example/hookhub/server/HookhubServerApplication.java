package com.example.hookhub.server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class HookhubServerApplication {

    public static void main(String[] args) {
        SpringApplication.run(HookhubServerApplication.class, args);
    }

}
