package org.jaffre;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling  // balayage des parties inactives
public class JaffreApplication {
    public static void main(String[] args) {
        SpringApplication.run(JaffreApplication.class, args);
    }
}
