package com.example.chatsync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class ChatSyncApplication {

    public static void main(String[] args) {
        SpringApplication.run(ChatSyncApplication.class, args);
    }
}
