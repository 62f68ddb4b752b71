package com.snuffles.journal;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PortfolioJournalApplication {

    public static void main(String[] args) {
        SpringApplication.run(PortfolioJournalApplication.class, args);
    }
}
