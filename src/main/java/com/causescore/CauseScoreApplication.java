package com.causescore;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CauseScoreApplication {

    public static void main(String[] args) {
        SpringApplication.run(CauseScoreApplication.class, args);
    }
}
