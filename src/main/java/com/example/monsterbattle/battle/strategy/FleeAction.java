package com.example.monsterbattle.battle.strategy;

import org.springframework.stereotype.Component;

import com.example.monsterbattle.battle.domain.BattleAction;
import com.example.monsterbattle.battle.domain.BattlePhase;
import com.example.monsterbattle.battle.domain.BattleState;
import com.example.monsterbattle.battle.domain.Monster;
import com.example.monsterbattle.battle.random.RandomSource;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 도망 전략
 * - 확률 = clamp(0.5 + 0.01 * (내 민첩 - 상대 민첩), 0.1, 0.9)
 * - 성공 시 ESCAPED 로 종료
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FleeAction implements ActionStrategy {

    static final double BASE_CHANCE = 0.5;
    static final double AGILITY_STEP = 0.01;
    static final double MIN_CHANCE = 0.1;
    static final double MAX_CHANCE = 0.9;

    private final RandomSource randomSource;

    @Override
    public ActionOutcome execute(BattleState state, BattleAction action, Monster actor) {
        if (!state.isCanFlee()) {
            return ActionOutcome.rejected(state, "이 배틀에서는 도망칠 수 없다!");
        }

        int opposingAgility = state.activeCombatant(action.side().opposite())
                .map(m -> m.getStats().getAgility())
                .orElse(0);
        double chance = escapeChance(actor.getStats().getAgility(), opposingAgility);

        if (randomSource.nextDouble() < chance) {
            log.debug("[행동] 도망 성공: actor={}, chance={}", actor.getName(), chance);
            return ActionOutcome.applied(state.withPhase(BattlePhase.ESCAPED), actor.getName() + "은(는) 무사히 도망쳤다!");
        }
        return ActionOutcome.applied(state, actor.getName() + "은(는) 도망치지 못했다!");
    }

    public static double escapeChance(int fleeingAgility, int opposingAgility) {
        double raw = BASE_CHANCE + AGILITY_STEP * (fleeingAgility - opposingAgility);
        return Math.max(MIN_CHANCE, Math.min(raw, MAX_CHANCE));
    }
}
