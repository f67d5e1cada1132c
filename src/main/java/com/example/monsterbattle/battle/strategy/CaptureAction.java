package com.example.monsterbattle.battle.strategy;

import java.util.Optional;

import org.springframework.stereotype.Component;

import com.example.monsterbattle.battle.catalog.CaptureRateCalculator;
import com.example.monsterbattle.battle.domain.BattleAction;
import com.example.monsterbattle.battle.domain.BattlePhase;
import com.example.monsterbattle.battle.domain.BattleState;
import com.example.monsterbattle.battle.domain.Monster;
import com.example.monsterbattle.battle.domain.Side;
import com.example.monsterbattle.battle.random.RandomSource;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 포획 전략
 * - 야생 배틀 + 포획 가능일 때만 시도
 * - 확률 계산은 CaptureRateCalculator 에 위임
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CaptureAction implements ActionStrategy {

    private final CaptureRateCalculator captureRateCalculator;
    private final RandomSource randomSource;

    @Override
    public ActionOutcome execute(BattleState state, BattleAction action, Monster actor) {
        if (!state.isWildEncounter() || !state.isCanCapture() || action.side() != Side.PLAYER) {
            return ActionOutcome.rejected(state, "이 몬스터는 포획할 수 없다!");
        }

        Optional<Monster> found = state.activeCombatant(Side.ENEMY);
        if (found.isEmpty() || found.get().isFainted()) {
            return ActionOutcome.noOp(state);
        }

        Monster target = found.get();
        double probability = captureRateCalculator.probability(target, action.itemId());
        if (randomSource.nextDouble() < probability) {
            log.debug("[행동] 포획 성공: target={}, probability={}", target.getName(), probability);
            return ActionOutcome.applied(state.withPhase(BattlePhase.CAPTURED), target.getName() + "을(를) 포획했다!");
        }
        return ActionOutcome.applied(state, target.getName() + "이(가) 포획에서 벗어났다!");
    }
}
