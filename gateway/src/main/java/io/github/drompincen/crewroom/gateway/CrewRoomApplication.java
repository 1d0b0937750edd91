package io.github.drompincen.crewroom.gateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication(scanBasePackages = "io.github.drompincen.crewroom")
@EnableScheduling
public class CrewRoomApplication {

    public static void main(String[] args) {
        SpringApplication.run(CrewRoomApplication.class, args);
    }
}
