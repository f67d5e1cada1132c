package com.example.monsterbattle.battle.engine;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.springframework.stereotype.Component;

import com.example.monsterbattle.battle.domain.BattleAction;
import com.example.monsterbattle.battle.domain.BattlePhase;
import com.example.monsterbattle.battle.domain.BattleState;
import com.example.monsterbattle.battle.domain.Monster;
import com.example.monsterbattle.battle.domain.Side;
import com.example.monsterbattle.battle.domain.TurnResult;
import com.example.monsterbattle.battle.pacing.PacingPoint;
import com.example.monsterbattle.battle.pacing.PacingScheduler;
import com.example.monsterbattle.battle.strategy.ActionOutcome;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 배틀 페이즈 상태 머신.
 *
 * <pre>
 * SELECTING → RESOLVING → VICTORY | DEFEAT | CAPTURED | ESCAPED
 *                 └──────→ SELECTING (turn + 1)
 * </pre>
 *
 * 동시 전멸 시에는 아군 전멸을 먼저 확인하므로 DEFEAT 가 된다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BattleStateMachine {

    private final TurnOrderResolver turnOrderResolver;
    private final ActionExecutor actionExecutor;
    private final RecruitmentJudge recruitmentJudge;
    private final PacingScheduler pacingScheduler;

    /**
     * 한 턴 처리
     *
     * @param state        SELECTING 상태의 배틀
     * @param playerAction 플레이어 행동
     * @param enemyAction  적 행동
     * @return 새 상태와 이벤트 목록. 이미 종료된 배틀이면 상태를 그대로 돌려준다.
     */
    public TurnResult resolveTurn(BattleState state, BattleAction playerAction, BattleAction enemyAction) {
        Objects.requireNonNull(state, "state");
        if (state.getPhase().isTerminal()) {
            return new TurnResult(state, List.of());
        }

        BattleState current = state.withPhase(BattlePhase.RESOLVING);
        List<BattleAction> ordered = turnOrderResolver.order(current, playerAction, enemyAction);
        List<String> events = new ArrayList<>();

        for (int i = 0; i < ordered.size(); i++) {
            if (i > 0) {
                pacingScheduler.pause(PacingPoint.BETWEEN_ACTIONS);
            }
            BattleAction action = ordered.get(i);
            ActionOutcome outcome = actionExecutor.execute(current, action);
            current = outcome.getState();
            outcome.event().ifPresent(events::add);
            log.debug("[턴] turn={}, {}번째 행동: kind={}, side={}, applied={}", state.getTurn(), i + 1,
                    action.kind(), action.side(), outcome.isApplied());

            if (current.getPhase() == BattlePhase.CAPTURED || current.getPhase() == BattlePhase.ESCAPED) {
                return finish(current, events);
            }

            BattlePhase terminal = checkTermination(current);
            if (terminal != null) {
                current = current.withPhase(terminal);
                events.add(terminal == BattlePhase.VICTORY ? "승리했다!" : "패배했다...");
                if (terminal == BattlePhase.VICTORY) {
                    BattleState judged = recruitmentJudge.judge(current);
                    if (judged.getRecruitedEnemySlot() != null) {
                        events.add(judged.getLastEvent());
                    }
                    current = judged;
                }
                return finish(current, events);
            }
        }

        pacingScheduler.pause(PacingPoint.BEFORE_NEXT_TURN);
        BattleState next = clearGuards(current).toBuilder()
                .phase(BattlePhase.SELECTING)
                .turn(current.getTurn() + 1)
                .lastEvent(events.isEmpty() ? current.getLastEvent() : events.get(events.size() - 1))
                .build();
        return new TurnResult(next, events);
    }

    /**
     * 아군 전멸 → DEFEAT, 적 전멸 → VICTORY, 둘 다 아니면 null
     */
    BattlePhase checkTermination(BattleState state) {
        if (state.isSideDefeated(Side.PLAYER)) {
            return BattlePhase.DEFEAT;
        }
        if (state.isSideDefeated(Side.ENEMY)) {
            return BattlePhase.VICTORY;
        }
        return null;
    }

    private TurnResult finish(BattleState state, List<String> events) {
        BattleState finished = clearGuards(state).toBuilder()
                .lastEvent(events.isEmpty() ? state.getLastEvent() : events.get(events.size() - 1))
                .build();
        log.info("[배틀] 종료: phase={}, turn={}", finished.getPhase(), finished.getTurn());
        return new TurnResult(finished, events);
    }

    private BattleState clearGuards(BattleState state) {
        BattleState cleared = state;
        for (Side side : Side.values()) {
            List<Monster> party = cleared.party(side);
            for (int slot = 0; slot < party.size(); slot++) {
                if (party.get(slot).isDefending()) {
                    cleared = cleared.updateCombatant(side, slot, m -> m.withDefending(false));
                }
            }
        }
        return cleared;
    }
}
