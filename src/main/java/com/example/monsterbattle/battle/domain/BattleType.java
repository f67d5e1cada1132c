package com.example.monsterbattle.battle.domain;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum BattleType {
    WILD_ENCOUNTER(true, true, true),
    TRAINER_BATTLE(false, true, false),
    BOSS_BATTLE(false, false, false);

    private final boolean wildEncounter;
    private final boolean canFlee;
    private final boolean canCapture;
}
