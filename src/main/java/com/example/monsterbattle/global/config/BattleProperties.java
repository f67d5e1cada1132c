package com.example.monsterbattle.global.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

import lombok.Getter;
import lombok.Setter;

/**
 * application.yml 의 battle.* 설정
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "battle")
public class BattleProperties {

    private final Pacing pacing = new Pacing();
    private final Random random = new Random();
    private final Session session = new Session();

    @Getter
    @Setter
    public static class Pacing {
        // false 면 행동 사이 대기 없음 (헤드리스/테스트)
        private boolean enabled = false;
        private Duration actionDelay = Duration.ofMillis(500);
    }

    @Getter
    @Setter
    public static class Random {
        // 지정 시 프로세스 전체가 하나의 난수 열을 공유한다.
        // 동시에 진행 중인 배틀이 하나뿐일 때만 배틀 단위로 재현된다.
        private Long seed;
    }

    @Getter
    @Setter
    public static class Session {
        private Duration ttl = Duration.ofMinutes(30);
        private long cleanupIntervalMs = 60_000L;
    }
}
