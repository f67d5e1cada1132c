package com.example.monsterbattle.battle.strategy;

import org.springframework.stereotype.Component;

import com.example.monsterbattle.battle.domain.BattleAction;
import com.example.monsterbattle.battle.domain.BattleState;
import com.example.monsterbattle.battle.domain.Monster;
import com.example.monsterbattle.battle.domain.Skill;
import com.example.monsterbattle.battle.domain.SkillCategory;
import com.example.monsterbattle.battle.domain.SkillTarget;

import lombok.RequiredArgsConstructor;

/**
 * 기본 공격 전략
 * - 위력 50 / 명중 95 / MP 0 물리 스킬로 처리
 */
@Component
@RequiredArgsConstructor
public class AttackAction implements ActionStrategy {

    static final Skill BASIC_ATTACK = Skill.builder()
            .id("basic_attack")
            .name("공격")
            .category(SkillCategory.PHYSICAL)
            .target(SkillTarget.SINGLE_ENEMY)
            .mpCost(0)
            .power(50)
            .accuracy(95)
            .build();

    private final SkillEffectApplier skillEffectApplier;

    @Override
    public ActionOutcome execute(BattleState state, BattleAction action, Monster actor) {
        return skillEffectApplier.apply(state, action, actor, BASIC_ATTACK);
    }
}
