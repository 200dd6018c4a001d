package io.github.drompincen.worktrack.gateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.data.mongodb.repository.config.EnableMongoRepositories;

@SpringBootApplication(scanBasePackages = {
        "io.github.drompincen.worktrack.gateway",
        "io.github.drompincen.worktrack.persistence"
})
@EnableMongoRepositories(basePackages = "io.github.drompincen.worktrack.persistence.repository")
public class WorkTrackGatewayApplication {

    public static void main(String[] args) {
        SpringApplication.run(WorkTrackGatewayApplication.class, args);
    }
}
