package com.example.monsterbattle.battle.domain;

public enum SkillCategory {
    PHYSICAL, // 공격력 vs 방어력
    MAGICAL, // 마력 vs 지혜
    HEALING, // 아군 HP 회복
    SUPPORT // 데미지 없음
}
