package com.example.monsterbattle.battle.dto.response;

import java.util.List;

import com.example.monsterbattle.battle.domain.BattleSession;
import com.example.monsterbattle.battle.domain.BattleState;

public record BattleResponse(
        String battleId,
        BattleState state,
        List<String> events) {

    public static BattleResponse from(BattleSession session) {
        return new BattleResponse(session.getBattleId(), session.getState(), session.getLastEvents());
    }
}
