package com.example.monsterbattle.battle.strategy;

import org.springframework.stereotype.Component;

import com.example.monsterbattle.battle.domain.BattleAction;
import com.example.monsterbattle.battle.domain.BattleState;
import com.example.monsterbattle.battle.domain.Monster;

/**
 * 방어 전략
 * - 이번 턴이 끝날 때까지 받는 데미지 절반
 */
@Component
public class DefendAction implements ActionStrategy {

    @Override
    public ActionOutcome execute(BattleState state, BattleAction action, Monster actor) {
        BattleState next = state.withCombatant(action.side(), action.actorSlot(), actor.withDefending(true));
        return ActionOutcome.applied(next, actor.getName() + "은(는) 방어 태세를 취했다!");
    }
}
