package com.feedrank;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FeedRankApplication {

    public static void main(String[] args) {
        SpringApplication.run(FeedRankApplication.class, args);
    }
}
