package com.example.monsterbattle.battle.domain;

import java.util.Objects;

import lombok.Builder;
import lombok.Value;

/**
 * 스킬 정의 (불변). 스킬 카탈로그에서 조회된다.
 */
@Value
public class Skill {

    String id;
    String name;
    SkillCategory category;
    SkillTarget target;
    int mpCost;
    int power;
    int accuracy;
    int priority;

    @Builder
    public Skill(String id, String name, SkillCategory category, SkillTarget target, int mpCost, int power,
            int accuracy, int priority) {
        if (mpCost < 0 || power < 0) {
            throw new IllegalArgumentException("MP 소모량과 위력은 0 이상이어야 합니다: mpCost=" + mpCost + ", power=" + power);
        }
        if (accuracy < 0 || accuracy > 100) {
            throw new IllegalArgumentException("명중률은 0 ~ 100 이어야 합니다: " + accuracy);
        }
        this.id = Objects.requireNonNull(id, "id");
        this.name = name;
        this.category = Objects.requireNonNull(category, "category");
        this.target = Objects.requireNonNull(target, "target");
        this.mpCost = mpCost;
        this.power = power;
        this.accuracy = accuracy;
        this.priority = priority;
    }

    public boolean isDamaging() {
        return power > 0 && (category == SkillCategory.PHYSICAL || category == SkillCategory.MAGICAL);
    }

    public boolean isHealing() {
        return power > 0 && category == SkillCategory.HEALING;
    }

    public boolean isPhysical() {
        return category == SkillCategory.PHYSICAL;
    }

    public static class SkillBuilder {
        private int accuracy = 100;
    }
}
