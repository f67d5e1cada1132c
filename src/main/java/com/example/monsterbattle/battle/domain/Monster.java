package com.example.monsterbattle.battle.domain;

import java.util.List;
import java.util.Objects;

import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * 배틀 참가 몬스터.
 *
 * <p>HP/MP는 생성 시점에 항상 {@code [0, max]} 범위로 보정되므로
 * 어떤 경로로 만들어진 인스턴스든 범위를 벗어날 수 없다.
 */
@Value
@With
public class Monster {

    String id;
    String name;
    int level;
    MonsterType primaryType;
    MonsterType secondaryType;
    int currentHp;
    int maxHp;
    int currentMp;
    int maxMp;
    StatBlock stats;
    List<String> skills;
    int captureRate;
    int affection;
    boolean defending;

    @Builder(toBuilder = true)
    public Monster(String id, String name, int level, MonsterType primaryType, MonsterType secondaryType,
            int currentHp, int maxHp, int currentMp, int maxMp, StatBlock stats, List<String> skills,
            int captureRate, int affection, boolean defending) {
        if (level < 1) {
            throw new IllegalArgumentException("레벨은 1 이상이어야 합니다: " + level);
        }
        if (maxHp < 1 || maxMp < 0) {
            throw new IllegalArgumentException("최대 HP/MP 값이 올바르지 않습니다: hp=" + maxHp + ", mp=" + maxMp);
        }
        this.id = id;
        this.name = name;
        this.level = level;
        this.primaryType = Objects.requireNonNull(primaryType, "primaryType");
        this.secondaryType = secondaryType;
        this.maxHp = maxHp;
        this.maxMp = maxMp;
        this.currentHp = clamp(currentHp, maxHp);
        this.currentMp = clamp(currentMp, maxMp);
        this.stats = Objects.requireNonNull(stats, "stats");
        this.skills = skills == null ? List.of() : List.copyOf(skills);
        this.captureRate = captureRate;
        this.affection = affection;
        this.defending = defending;
    }

    public boolean isFainted() {
        return currentHp <= 0;
    }

    public double hpRatio() {
        return (double) currentHp / maxHp;
    }

    public Monster takeDamage(int amount) {
        return withCurrentHp(currentHp - amount);
    }

    public Monster heal(int amount) {
        return withCurrentHp(currentHp + amount);
    }

    public Monster spendMp(int amount) {
        return withCurrentMp(currentMp - amount);
    }

    private static int clamp(int value, int max) {
        return Math.max(0, Math.min(value, max));
    }

    public static class MonsterBuilder {
        private int captureRate = 100;
    }
}
