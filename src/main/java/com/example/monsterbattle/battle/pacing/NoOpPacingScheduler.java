package com.example.monsterbattle.battle.pacing;

public class NoOpPacingScheduler implements PacingScheduler {

    @Override
    public void pause(PacingPoint point) {
        // 대기 없음
    }
}
