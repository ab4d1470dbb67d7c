package com.autonomous.swarm;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class SwarmCoordinatorApplication {

    public static void main(String[] args) {
        SpringApplication.run(SwarmCoordinatorApplication.class, args);
    }
}
