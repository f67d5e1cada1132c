package com.example.monsterbattle.battle.ai;

import com.example.monsterbattle.battle.domain.BattleAction;
import com.example.monsterbattle.battle.domain.Side;

public class AttackRule implements DecisionRule {

    @Override
    public boolean matches(DecisionContext context) {
        return true;
    }

    @Override
    public BattleAction decide(DecisionContext context) {
        return BattleAction.attack(Side.ENEMY, context.slot());
    }
}
