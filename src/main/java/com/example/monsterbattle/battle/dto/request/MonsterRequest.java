package com.example.monsterbattle.battle.dto.request;

import java.util.List;

import com.example.monsterbattle.battle.domain.Monster;
import com.example.monsterbattle.battle.domain.MonsterType;
import com.example.monsterbattle.battle.domain.StatBlock;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record MonsterRequest(
        @NotBlank String id,
        @NotBlank(message = "몬스터 이름은 필수입니다.") String name,
        @Min(value = 1, message = "레벨은 1 이상이어야 합니다.") int level,
        @NotNull(message = "주 타입은 필수입니다.") MonsterType primaryType,
        MonsterType secondaryType,
        @Min(0) int currentHp,
        @Min(value = 1, message = "최대 HP는 1 이상이어야 합니다.") int maxHp,
        @Min(0) int currentMp,
        @Min(0) int maxMp,
        @Min(0) int attack,
        @Min(0) int defense,
        @Min(0) int agility,
        @Min(0) int magic,
        @Min(0) int wisdom,
        List<String> skills,
        @Min(0) @Max(255) Integer captureRate,
        @Min(0) @Max(100) int affection) {

    public Monster toMonster() {
        return Monster.builder()
                .id(id)
                .name(name)
                .level(level)
                .primaryType(primaryType)
                .secondaryType(secondaryType)
                .currentHp(currentHp)
                .maxHp(maxHp)
                .currentMp(currentMp)
                .maxMp(maxMp)
                .stats(StatBlock.builder()
                        .attack(attack)
                        .defense(defense)
                        .agility(agility)
                        .magic(magic)
                        .wisdom(wisdom)
                        .build())
                .skills(skills)
                .captureRate(captureRate == null ? 100 : captureRate)
                .affection(affection)
                .build();
    }
}
