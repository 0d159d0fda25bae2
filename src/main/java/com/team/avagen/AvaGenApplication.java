package com.team.avagen;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AvaGenApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(AvaGenApplication.class, args)));
    }
}
