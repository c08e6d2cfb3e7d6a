package com.accountability.leaderboard;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AccountabilityLeaderboardApplication {

    public static void main(String[] args) {
        SpringApplication.run(AccountabilityLeaderboardApplication.class, args);
    }
}
