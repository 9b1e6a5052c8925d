package com.texsynth.server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TextureSynthesisApplication {

    public static void main(String[] args) {
        SpringApplication.run(TextureSynthesisApplication.class, args);
    }
}
