package com.example.monsterbattle.battle.domain;

public enum ActionKind {
    ATTACK, // 기본 공격
    USE_SKILL, // 스킬 사용
    DEFEND, // 방어
    FLEE, // 도망
    CAPTURE, // 포획 (야생 배틀 전용)
    TREAT // 먹이 주기 (야생 배틀 전용)
}
