package it.aw.issueprioritizer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class IssuePrioritizerApplication {

    public static void main(String[] args) {
        SpringApplication.run(IssuePrioritizerApplication.class, args);
    }
}
