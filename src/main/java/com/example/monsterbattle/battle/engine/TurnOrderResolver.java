package com.example.monsterbattle.battle.engine;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import org.springframework.stereotype.Component;

import com.example.monsterbattle.battle.domain.BattleAction;
import com.example.monsterbattle.battle.domain.BattleState;
import com.example.monsterbattle.battle.domain.Monster;
import com.example.monsterbattle.battle.domain.StatBlock;

/**
 * 행동 순서 결정: priority * 1000 + 민첩 내림차순, 동률이면 제출 순서 유지
 */
@Component
public class TurnOrderResolver {

    private static final int PRIORITY_WEIGHT = 1000;

    public List<BattleAction> order(BattleState state, BattleAction first, BattleAction second) {
        List<BattleAction> actions = new ArrayList<>(List.of(first, second));
        // List.sort는 안정 정렬
        actions.sort(Comparator.comparingInt((BattleAction action) -> orderKey(state, action)).reversed());
        return actions;
    }

    public int orderKey(BattleState state, BattleAction action) {
        int agility = state.combatant(action.side(), action.actorSlot())
                .map(Monster::getStats)
                .map(StatBlock::getAgility)
                .orElse(0);
        return action.priority() * PRIORITY_WEIGHT + agility;
    }
}
