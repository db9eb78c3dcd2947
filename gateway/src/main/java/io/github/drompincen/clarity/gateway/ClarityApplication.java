package io.github.drompincen.clarity.gateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.data.mongodb.repository.config.EnableMongoRepositories;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication(scanBasePackages = "io.github.drompincen.clarity")
@EnableMongoRepositories(basePackages = "io.github.drompincen.clarity.persistence.repository")
@EnableScheduling
public class ClarityApplication {

    public static void main(String[] args) {
        SpringApplication.run(ClarityApplication.class, args);
    }
}
