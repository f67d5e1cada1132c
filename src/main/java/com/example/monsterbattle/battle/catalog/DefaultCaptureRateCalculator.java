package com.example.monsterbattle.battle.catalog;

import java.util.Map;

import org.springframework.stereotype.Component;

import com.example.monsterbattle.battle.domain.Monster;

/**
 * 기본 포획 확률 계산
 * - 종족 포획률(0~255) 기반
 * - HP가 낮을수록 확률 상승
 * - 포획 아이템 등급별 배율, 최대 95%
 */
@Component
public class DefaultCaptureRateCalculator implements CaptureRateCalculator {

    private static final double MAX_PROBABILITY = 0.95;

    private static final Map<String, Double> ITEM_MODIFIERS = Map.of(
            "basic_capture", 1.0,
            "great_capture", 1.5,
            "ultra_capture", 2.0,
            "master_capture", 3.0);

    @Override
    public double probability(Monster target, String itemId) {
        double baseRate = target.getCaptureRate() / 255.0;
        double hpModifier = (1.0 - target.hpRatio()) * 0.5 + 0.5;
        double itemModifier = itemId == null ? 1.0 : ITEM_MODIFIERS.getOrDefault(itemId, 1.0);

        double probability = baseRate * hpModifier * itemModifier;
        return Math.max(0.0, Math.min(probability, MAX_PROBABILITY));
    }
}
