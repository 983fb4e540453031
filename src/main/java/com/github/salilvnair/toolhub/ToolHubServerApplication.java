package com.github.salilvnair.toolhub;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ToolHubServerApplication {

    public static void main(String[] args) {
        SpringApplication.run(ToolHubServerApplication.class, args);
    }
}
