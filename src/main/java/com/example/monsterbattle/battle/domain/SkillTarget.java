package com.example.monsterbattle.battle.domain;

/**
 * 스킬 대상 범위. ALL 은 양 진영의 살아있는 몬스터 전부.
 */
public enum SkillTarget {
    SELF, SINGLE_ENEMY, ALL_ENEMIES, SINGLE_ALLY, ALL_ALLIES, ALL
}
