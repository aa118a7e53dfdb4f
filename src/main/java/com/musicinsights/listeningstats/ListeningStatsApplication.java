package com.musicinsights.listeningstats;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ListeningStatsApplication {

    public static void main(String[] args) {
        SpringApplication.run(ListeningStatsApplication.class, args);
    }
}
