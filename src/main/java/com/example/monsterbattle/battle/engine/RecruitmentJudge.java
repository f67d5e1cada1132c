package com.example.monsterbattle.battle.engine;

import org.springframework.stereotype.Component;

import com.example.monsterbattle.battle.domain.BattleState;
import com.example.monsterbattle.battle.domain.Monster;
import com.example.monsterbattle.battle.domain.Side;
import com.example.monsterbattle.battle.random.RandomSource;

import lombok.RequiredArgsConstructor;

/**
 * 야생 배틀 승리 후 쓰러진 몬스터가 동료가 되고 싶어하는지 판정
 */
@Component
@RequiredArgsConstructor
public class RecruitmentJudge {

    private static final double BASE_CHANCE = 0.1;
    private static final double AFFECTION_STEP = 0.005;
    private static final double LEVEL_PENALTY_STEP = 0.01;
    private static final int PENALTY_FREE_LEVEL = 5;
    private static final double MAX_CHANCE = 0.8;

    private final RandomSource randomSource;

    /**
     * @return 합류를 원하면 해당 적 슬롯이 기록된 새 상태, 아니면 그대로
     */
    public BattleState judge(BattleState state) {
        if (!state.isWildEncounter()) {
            return state;
        }
        int slot = state.getActiveEnemySlot();
        Monster candidate = state.combatant(Side.ENEMY, slot).orElse(null);
        if (candidate == null) {
            return state;
        }
        if (randomSource.nextDouble() < joinChance(candidate)) {
            return state.toBuilder()
                    .recruitedEnemySlot(slot)
                    .lastEvent(candidate.getName() + "이(가) 동료가 되고 싶어한다!")
                    .build();
        }
        return state;
    }

    public static double joinChance(Monster monster) {
        double affectionBonus = monster.getAffection() * AFFECTION_STEP;
        double levelPenalty = Math.max(0, monster.getLevel() - PENALTY_FREE_LEVEL) * LEVEL_PENALTY_STEP;
        double chance = BASE_CHANCE + affectionBonus - levelPenalty;
        return Math.max(0.0, Math.min(chance, MAX_CHANCE));
    }
}
