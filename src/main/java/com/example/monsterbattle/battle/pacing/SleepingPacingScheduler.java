package com.example.monsterbattle.battle.pacing;

import java.time.Duration;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 행동 사이에 고정 시간만큼 대기하는 스케줄러 (애니메이션 연출용)
 */
@Slf4j
@RequiredArgsConstructor
public class SleepingPacingScheduler implements PacingScheduler {

    private final Duration delay;

    @Override
    public void pause(PacingPoint point) {
        if (delay.isZero() || delay.isNegative()) {
            return;
        }
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[연출] 대기 중 인터럽트 발생: point={}", point);
        }
    }
}
