package com.example.monsterbattle.battle.support;

import com.example.monsterbattle.battle.domain.Monster;
import com.example.monsterbattle.battle.domain.MonsterType;
import com.example.monsterbattle.battle.domain.StatBlock;

/**
 * 테스트용 몬스터 생성 헬퍼.
 * 기본값: 레벨 10, NORMAL, HP 100/100, MP 20/20, 모든 능력치 50
 */
public final class Monsters {

    private Monsters() {
    }

    public static Monster.MonsterBuilder monster(String name) {
        return Monster.builder()
                .id(name.toLowerCase())
                .name(name)
                .level(10)
                .primaryType(MonsterType.NORMAL)
                .currentHp(100)
                .maxHp(100)
                .currentMp(20)
                .maxMp(20)
                .stats(stats(50, 50, 50, 50, 50));
    }

    public static StatBlock stats(int attack, int defense, int agility, int magic, int wisdom) {
        return StatBlock.builder()
                .attack(attack)
                .defense(defense)
                .agility(agility)
                .magic(magic)
                .wisdom(wisdom)
                .build();
    }

    public static StatBlock agility(int agility) {
        return stats(50, 50, agility, 50, 50);
    }
}
