package com.example.monsterbattle.battle.catalog;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.springframework.stereotype.Component;

import com.example.monsterbattle.battle.domain.Skill;
import com.example.monsterbattle.battle.domain.SkillCategory;
import com.example.monsterbattle.battle.domain.SkillTarget;

/**
 * 기본 스킬 카탈로그 (메모리)
 */
@Component
public class InMemorySkillCatalog implements SkillCatalog {

    private final Map<String, Skill> skills = new LinkedHashMap<>();

    public InMemorySkillCatalog() {
        this(defaultSkills());
    }

    public InMemorySkillCatalog(List<Skill> skills) {
        skills.forEach(skill -> this.skills.put(skill.getId(), skill));
    }

    @Override
    public Optional<Skill> lookup(String skillId) {
        if (skillId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(skills.get(skillId));
    }

    @Override
    public List<Skill> findAll() {
        return new ArrayList<>(skills.values());
    }

    private static List<Skill> defaultSkills() {
        return List.of(
                Skill.builder().id("fireball").name("Fireball")
                        .category(SkillCategory.MAGICAL).target(SkillTarget.SINGLE_ENEMY)
                        .mpCost(8).power(75).accuracy(90).build(),
                Skill.builder().id("heal").name("Heal")
                        .category(SkillCategory.HEALING).target(SkillTarget.SELF)
                        .mpCost(6).power(50).build(),
                Skill.builder().id("tackle").name("Tackle")
                        .category(SkillCategory.PHYSICAL).target(SkillTarget.SINGLE_ENEMY)
                        .mpCost(0).power(60).accuracy(95).build(),
                Skill.builder().id("quick_strike").name("Quick Strike")
                        .category(SkillCategory.PHYSICAL).target(SkillTarget.SINGLE_ENEMY)
                        .mpCost(3).power(40).priority(1).build(),
                Skill.builder().id("thunderbolt").name("Thunderbolt")
                        .category(SkillCategory.MAGICAL).target(SkillTarget.SINGLE_ENEMY)
                        .mpCost(10).power(90).accuracy(90).build(),
                Skill.builder().id("blizzard").name("Blizzard")
                        .category(SkillCategory.MAGICAL).target(SkillTarget.ALL_ENEMIES)
                        .mpCost(14).power(60).accuracy(85).build(),
                Skill.builder().id("roar").name("Roar")
                        .category(SkillCategory.SUPPORT).target(SkillTarget.ALL_ENEMIES)
                        .mpCost(2).power(0).build(),
                Skill.builder().id("group_heal").name("Group Heal")
                        .category(SkillCategory.HEALING).target(SkillTarget.ALL_ALLIES)
                        .mpCost(12).power(35).build(),
                Skill.builder().id("inferno").name("Inferno")
                        .category(SkillCategory.MAGICAL).target(SkillTarget.SINGLE_ENEMY)
                        .mpCost(20).power(120).accuracy(80).build(),
                Skill.builder().id("earthquake").name("Earthquake")
                        .category(SkillCategory.PHYSICAL).target(SkillTarget.ALL)
                        .mpCost(16).power(70).accuracy(100).build());
    }
}
