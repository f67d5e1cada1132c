package com.example.monsterbattle.battle.catalog;

import com.example.monsterbattle.battle.domain.Monster;

/**
 * 포획 확률 계산 인터페이스
 */
public interface CaptureRateCalculator {

    /**
     * @param target 포획 대상
     * @param itemId 사용한 포획 아이템
     * @return [0, 1] 범위의 포획 확률
     */
    double probability(Monster target, String itemId);
}
