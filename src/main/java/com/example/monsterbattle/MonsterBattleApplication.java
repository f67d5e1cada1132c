package com.example.monsterbattle;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
public class MonsterBattleApplication {

    public static void main(String[] args) {
        SpringApplication.run(MonsterBattleApplication.class, args);
    }
}
