package com.example.monsterbattle.battle.service;

import java.time.Instant;

import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import com.example.monsterbattle.global.config.BattleProperties;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Component
@RequiredArgsConstructor
public class BattleSessionCleanupTask {

    private final BattleService battleService;
    private final BattleProperties battleProperties;

    @Scheduled(fixedDelayString = "${battle.session.cleanup-interval-ms:60000}")
    public void cleanup() {
        try {
            int evicted = battleService.evictStaleSessions(Instant.now(), battleProperties.getSession().getTtl());
            if (evicted > 0) {
                log.info("[세션] 정리 완료: {}건 삭제", evicted);
            }
        } catch (Exception e) {
            log.error("[세션] 정리 중 오류 발생", e);
        }
    }
}
