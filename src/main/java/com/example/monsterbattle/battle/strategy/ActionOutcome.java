package com.example.monsterbattle.battle.strategy;

import java.util.Optional;

import com.example.monsterbattle.battle.domain.BattleState;

import lombok.Builder;
import lombok.Getter;

/**
 * 행동 하나를 적용한 결과
 */
@Getter
@Builder
public class ActionOutcome {
    private final BattleState state;
    private final String message; // null 이면 이벤트 없음 (no-op)
    private final boolean applied;

    public static ActionOutcome noOp(BattleState state) {
        return ActionOutcome.builder()
                .state(state)
                .applied(false)
                .build();
    }

    /**
     * 상태는 그대로 두고 안내 메시지만 남긴다 (허용되지 않은 도망/포획 등)
     */
    public static ActionOutcome rejected(BattleState state, String message) {
        return ActionOutcome.builder()
                .state(state)
                .message(message)
                .applied(false)
                .build();
    }

    public static ActionOutcome applied(BattleState state, String message) {
        return ActionOutcome.builder()
                .state(state)
                .message(message)
                .applied(true)
                .build();
    }

    public Optional<String> event() {
        return Optional.ofNullable(message);
    }
}
