package com.followchat.social.bootstrap;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "com.followchat.social")
public class FollowChatApplication {
    public static void main(String[] args) {
        SpringApplication.run(FollowChatApplication.class, args);
    }
}
