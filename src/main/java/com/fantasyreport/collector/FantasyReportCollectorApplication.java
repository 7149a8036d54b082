package com.fantasyreport.collector;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class FantasyReportCollectorApplication {

    public static void main(String[] args) {
        SpringApplication.run(FantasyReportCollectorApplication.class, args);
    }
}
