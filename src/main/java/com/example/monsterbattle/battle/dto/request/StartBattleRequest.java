package com.example.monsterbattle.battle.dto.request;

import java.util.List;

import com.example.monsterbattle.battle.domain.BattleType;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

public record StartBattleRequest(
        @NotEmpty(message = "플레이어 파티는 비어 있을 수 없습니다.") List<@Valid MonsterRequest> playerParty,
        @NotEmpty(message = "적 파티는 비어 있을 수 없습니다.") List<@Valid MonsterRequest> enemyParty,
        @NotNull(message = "배틀 종류는 필수입니다.") BattleType battleType) {
}
