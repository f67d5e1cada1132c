package com.example.monsterbattle.battle.engine;

import org.springframework.stereotype.Component;

import com.example.monsterbattle.battle.domain.Monster;
import com.example.monsterbattle.battle.domain.Skill;
import com.example.monsterbattle.battle.domain.StatBlock;
import com.example.monsterbattle.battle.random.RandomSource;

import lombok.RequiredArgsConstructor;

/**
 * 단일 타격 데미지 계산.
 *
 * <pre>
 * base  = floor(공격스탯 * power / 100)
 * final = floor(base * 레벨보정 * 상성 * 치명타 * 난수보정), 최소 1
 * </pre>
 *
 * 상성은 양쪽의 주 타입만 본다 (보조 타입 미적용).
 * 난수는 치명타 판정 → 난수보정 순서로 두 번 뽑는다.
 */
@Component
@RequiredArgsConstructor
public class DamageCalculator {

    static final double CRITICAL_CHANCE = 0.05;
    static final double CRITICAL_MULTIPLIER = 1.5;
    static final double LEVEL_STEP = 0.05;
    static final double VARIANCE_MIN = 0.85;
    static final double VARIANCE_SPAN = 0.30;

    private final RandomSource randomSource;

    public int computeDamage(Monster attacker, Monster defender, Skill skill, boolean isPhysical) {
        StatBlock atk = attacker.getStats();
        int attackStat = isPhysical ? atk.getAttack() : atk.getMagic();

        int baseDamage = attackStat * skill.getPower() / 100;

        double levelModifier = 1.0 + LEVEL_STEP * (attacker.getLevel() - defender.getLevel());
        double typeModifier = TypeEffectivenessTable.multiplier(attacker.getPrimaryType(), defender.getPrimaryType());

        boolean critical = randomSource.nextDouble() < CRITICAL_CHANCE;
        double criticalModifier = critical ? CRITICAL_MULTIPLIER : 1.0;

        double varianceModifier = VARIANCE_MIN + randomSource.nextDouble() * VARIANCE_SPAN;

        int finalDamage = (int) Math.floor(
                baseDamage * levelModifier * typeModifier * criticalModifier * varianceModifier);
        return Math.max(1, finalDamage);
    }
}
