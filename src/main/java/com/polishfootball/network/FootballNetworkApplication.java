package com.polishfootball.network;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FootballNetworkApplication {

    public static void main(String[] args) {
        SpringApplication.run(FootballNetworkApplication.class, args);
    }
}
