package io.github.drompincen.worktrack.agent;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.data.mongodb.repository.config.EnableMongoRepositories;

@SpringBootApplication(scanBasePackages = {
        "io.github.drompincen.worktrack.agent",
        "io.github.drompincen.worktrack.persistence"
})
@EnableMongoRepositories(basePackages = "io.github.drompincen.worktrack.persistence.repository")
public class DesktopAgentApplication {

    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(DesktopAgentApplication.class);
        // Robot needs a display; Spring defaults to headless.
        app.setHeadless(false);
        app.run(args);
    }
}
