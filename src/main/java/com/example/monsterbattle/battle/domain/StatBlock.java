package com.example.monsterbattle.battle.domain;

import lombok.Builder;
import lombok.Value;

/**
 * 몬스터 능력치 (HP/MP 제외)
 */
@Value
@Builder
public class StatBlock {
    int attack;
    int defense;
    int agility;
    int magic;
    int wisdom;
}
