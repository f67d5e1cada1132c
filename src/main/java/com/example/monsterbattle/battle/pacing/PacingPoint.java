package com.example.monsterbattle.battle.pacing;

public enum PacingPoint {
    BETWEEN_ACTIONS, // 첫 번째 행동과 두 번째 행동 사이
    BEFORE_NEXT_TURN // 다음 턴 선택이 열리기 직전
}
