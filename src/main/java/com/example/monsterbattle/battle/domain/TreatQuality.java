package com.example.monsterbattle.battle.domain;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 먹이 등급별 호감도 상승량
 */
@Getter
@RequiredArgsConstructor
public enum TreatQuality {
    BASIC(5),
    QUALITY(10),
    PREMIUM(20);

    private final int affectionBonus;
}
