package com.example.monsterbattle.battle.domain;

import java.time.Instant;
import java.util.List;

import lombok.Builder;
import lombok.Getter;

/**
 * 진행 중인 배틀 한 건 (배틀 ID + 최신 상태 스냅샷)
 */
@Getter
@Builder(toBuilder = true)
public class BattleSession {

    private final String battleId;
    private final BattleType battleType;
    private final BattleState state;
    @Builder.Default
    private final List<String> lastEvents = List.of();
    private final Instant createdAt;
    private final Instant updatedAt;

    public boolean isFinished() {
        return state.getPhase().isTerminal();
    }
}
