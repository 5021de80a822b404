package com.communitychat.server;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@Slf4j
@SpringBootApplication
public class CommunityChatServerApplication {

    public static void main(String[] args) {
        log.info("Starting Community Chat Server...");
        SpringApplication.run(CommunityChatServerApplication.class, args);
        log.info("Community Chat Server started successfully!");
        log.info("Health check: http://{}:8080/health", args.length > 0 ? args[0] : "localhost");
        log.info("Websocket endpoint: ws://{}:8080/ws", args.length > 0 ? args[0] : "localhost");
    }
}
