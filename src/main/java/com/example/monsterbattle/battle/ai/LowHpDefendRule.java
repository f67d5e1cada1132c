package com.example.monsterbattle.battle.ai;

import com.example.monsterbattle.battle.domain.BattleAction;
import com.example.monsterbattle.battle.domain.Side;

/**
 * HP가 30% 미만이면 30% 확률로 방어
 */
public class LowHpDefendRule implements DecisionRule {

    static final double HP_RATIO_THRESHOLD = 0.3;
    static final double CHANCE = 0.3;

    @Override
    public boolean matches(DecisionContext context) {
        return context.actor().getCurrentHp() < context.actor().getMaxHp() * HP_RATIO_THRESHOLD
                && context.random().nextDouble() < CHANCE;
    }

    @Override
    public BattleAction decide(DecisionContext context) {
        return BattleAction.defend(Side.ENEMY, context.slot());
    }
}
