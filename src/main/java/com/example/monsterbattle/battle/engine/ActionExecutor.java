package com.example.monsterbattle.battle.engine;

import java.util.List;
import java.util.Optional;

import org.springframework.stereotype.Component;

import com.example.monsterbattle.battle.domain.BattleAction;
import com.example.monsterbattle.battle.domain.BattleState;
import com.example.monsterbattle.battle.domain.Monster;
import com.example.monsterbattle.battle.domain.Side;
import com.example.monsterbattle.battle.strategy.ActionOutcome;
import com.example.monsterbattle.battle.strategy.ActionStrategyFactory;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 행동 하나를 상태에 적용한다.
 * - 존재하지 않는 슬롯이나 쓰러진 몬스터의 행동은 no-op
 * - 적용 후 활성 몬스터가 쓰러진 진영은 다음 생존 슬롯으로 교체
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ActionExecutor {

    private final ActionStrategyFactory actionStrategyFactory;

    public ActionOutcome execute(BattleState state, BattleAction action) {
        Optional<Monster> actor = state.combatant(action.side(), action.actorSlot());
        if (actor.isEmpty() || actor.get().isFainted()) {
            log.debug("[행동] 행동 불가: side={}, slot={}", action.side(), action.actorSlot());
            return ActionOutcome.noOp(state);
        }

        ActionOutcome outcome = actionStrategyFactory.getStrategy(action.kind())
                .execute(state, action, actor.get());

        if (!outcome.isApplied()) {
            return outcome;
        }

        BattleState next = switchFaintedActive(switchFaintedActive(outcome.getState(), Side.PLAYER), Side.ENEMY);
        return ActionOutcome.builder()
                .state(next)
                .message(outcome.getMessage())
                .applied(true)
                .build();
    }

    private BattleState switchFaintedActive(BattleState state, Side side) {
        boolean activeDown = state.activeCombatant(side).map(Monster::isFainted).orElse(true);
        if (!activeDown) {
            return state;
        }
        List<Monster> party = state.party(side);
        for (int slot = 0; slot < party.size(); slot++) {
            if (!party.get(slot).isFainted()) {
                log.debug("[행동] 활성 몬스터 교체: side={}, slot={}", side, slot);
                return state.withActiveSlot(side, slot);
            }
        }
        return state;
    }
}
