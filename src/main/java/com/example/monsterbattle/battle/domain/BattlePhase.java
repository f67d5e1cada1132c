package com.example.monsterbattle.battle.domain;

public enum BattlePhase {
    SELECTING, // 행동 선택 대기
    RESOLVING, // 턴 처리 중
    VICTORY, // 적 전멸
    DEFEAT, // 아군 전멸
    CAPTURED, // 포획 성공
    ESCAPED; // 도망 성공

    public boolean isTerminal() {
        return this == VICTORY || this == DEFEAT || this == CAPTURED || this == ESCAPED;
    }
}
