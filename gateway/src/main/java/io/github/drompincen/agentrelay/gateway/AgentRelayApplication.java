package io.github.drompincen.agentrelay.gateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.data.mongodb.repository.config.EnableMongoRepositories;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication(scanBasePackages = "io.github.drompincen.agentrelay")
@EnableMongoRepositories(basePackages = "io.github.drompincen.agentrelay.persistence.repository")
@EnableScheduling
public class AgentRelayApplication {

    public static void main(String[] args) {
        SpringApplication.run(AgentRelayApplication.class, args);
    }
}
