package com.example.monsterbattle.battle.pacing;

/**
 * 연출 타이밍용 대기 지점.
 * 게임 로직에는 영향을 주지 않으며, 헤드리스 환경에서는 아무것도 하지 않는 구현을 쓴다.
 */
public interface PacingScheduler {

    void pause(PacingPoint point);
}
