package com.example.monsterbattle.global.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.example.monsterbattle.battle.pacing.NoOpPacingScheduler;
import com.example.monsterbattle.battle.pacing.PacingScheduler;
import com.example.monsterbattle.battle.pacing.SleepingPacingScheduler;
import com.example.monsterbattle.battle.random.RandomSource;
import com.example.monsterbattle.battle.random.SeededRandomSource;

import lombok.extern.slf4j.Slf4j;

/**
 * 배틀 엔진 협력 객체 설정
 * - RandomSource: 모든 세션이 공유하는 싱글톤. 시드 지정 시 난수 열이 고정된다
 * - PacingScheduler: 연출 대기 사용 여부
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(BattleProperties.class)
public class BattleConfig {

    @Bean
    public RandomSource randomSource(BattleProperties properties) {
        Long seed = properties.getRandom().getSeed();
        if (seed != null) {
            log.info("[설정] 고정 시드 난수 사용: seed={}", seed);
            return new SeededRandomSource(seed);
        }
        return new SeededRandomSource();
    }

    @Bean
    public PacingScheduler pacingScheduler(BattleProperties properties) {
        BattleProperties.Pacing pacing = properties.getPacing();
        if (pacing.isEnabled()) {
            log.info("[설정] 연출 대기 사용: delay={}", pacing.getActionDelay());
            return new SleepingPacingScheduler(pacing.getActionDelay());
        }
        return new NoOpPacingScheduler();
    }
}
