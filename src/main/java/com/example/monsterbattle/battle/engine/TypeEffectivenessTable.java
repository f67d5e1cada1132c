package com.example.monsterbattle.battle.engine;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

import com.example.monsterbattle.battle.domain.MonsterType;

/**
 * 공격 타입 x 방어 타입 상성표.
 * 등록되지 않은 조합은 모두 1.0 (보통)
 */
public final class TypeEffectivenessTable {

    public static final double SUPER_EFFECTIVE = 1.5;
    public static final double NEUTRAL = 1.0;
    public static final double RESISTED = 0.5;

    private static final Map<MonsterType, Map<MonsterType, Double>> MATRIX = new EnumMap<>(MonsterType.class);
    static {
        for (MonsterType type : MonsterType.values()) {
            MATRIX.put(type, new EnumMap<>(MonsterType.class));
        }
        // 효과 굉장함
        set(MonsterType.FIRE, MonsterType.GRASS, SUPER_EFFECTIVE);
        set(MonsterType.WATER, MonsterType.FIRE, SUPER_EFFECTIVE);
        set(MonsterType.GRASS, MonsterType.WATER, SUPER_EFFECTIVE);
        set(MonsterType.ELECTRIC, MonsterType.FLYING, SUPER_EFFECTIVE);
        set(MonsterType.FIGHTING, MonsterType.NORMAL, SUPER_EFFECTIVE);

        // 효과 별로
        set(MonsterType.FIRE, MonsterType.WATER, RESISTED);
        set(MonsterType.WATER, MonsterType.GRASS, RESISTED);
        set(MonsterType.GRASS, MonsterType.FIRE, RESISTED);
        set(MonsterType.ELECTRIC, MonsterType.GROUND, RESISTED);
    }

    private TypeEffectivenessTable() {
    }

    private static void set(MonsterType attacking, MonsterType defending, double multiplier) {
        MATRIX.get(attacking).put(defending, multiplier);
    }

    /**
     * 상성 배율 (1.5 / 1.0 / 0.5)
     */
    public static double multiplier(MonsterType attacking, MonsterType defending) {
        if (attacking == null || defending == null) {
            return NEUTRAL;
        }
        Double value = MATRIX.get(attacking).get(defending);
        return value != null ? value : NEUTRAL;
    }

    /**
     * 보통이 아닌 모든 조합 (공격 타입 순)
     */
    public static Map<TypePair, Double> definedPairs() {
        Map<TypePair, Double> pairs = new LinkedHashMap<>();
        MATRIX.forEach((attacking, row) -> row
                .forEach((defending, value) -> pairs.put(new TypePair(attacking, defending), value)));
        return Collections.unmodifiableMap(pairs);
    }

    public record TypePair(MonsterType attacking, MonsterType defending) {
    }
}
