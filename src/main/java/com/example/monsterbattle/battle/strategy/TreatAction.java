package com.example.monsterbattle.battle.strategy;

import java.util.Map;
import java.util.Optional;

import org.springframework.stereotype.Component;

import com.example.monsterbattle.battle.domain.BattleAction;
import com.example.monsterbattle.battle.domain.BattleState;
import com.example.monsterbattle.battle.domain.Monster;
import com.example.monsterbattle.battle.domain.MonsterType;
import com.example.monsterbattle.battle.domain.Side;
import com.example.monsterbattle.battle.domain.TreatQuality;

import lombok.extern.slf4j.Slf4j;

/**
 * 먹이 주기 전략
 * - 야생 배틀에서 플레이어만 사용 가능, 대상은 활성 적 몬스터
 * - 등급별 호감도 상승, 타입이 좋아하는 먹이면 추가 상승 (최대 100)
 * - 난수를 사용하지 않는다
 */
@Slf4j
@Component
public class TreatAction implements ActionStrategy {

    static final String DEFAULT_TREAT = "basic_treat";
    static final int MAX_AFFECTION = 100;
    // 합류 확률 +10%p 에 해당하는 호감도
    static final int PREFERRED_TYPE_BONUS = 20;

    private static final Map<String, TreatQuality> QUALITIES = Map.of(
            "basic_treat", TreatQuality.BASIC,
            "monster_food", TreatQuality.BASIC,
            "quality_treat", TreatQuality.QUALITY,
            "delicious_treat", TreatQuality.QUALITY,
            "premium_treat", TreatQuality.PREMIUM,
            "gourmet_treat", TreatQuality.PREMIUM);

    private static final Map<String, MonsterType> PREFERRED_TYPES = Map.of(
            "fire_treat", MonsterType.FIRE,
            "water_treat", MonsterType.WATER,
            "grass_treat", MonsterType.GRASS);

    private static final Map<String, String> NAMES = Map.of(
            "basic_treat", "Monster Food",
            "monster_food", "Monster Food",
            "quality_treat", "Quality Treat",
            "delicious_treat", "Delicious Treat",
            "premium_treat", "Premium Treat",
            "gourmet_treat", "Gourmet Treat");

    @Override
    public ActionOutcome execute(BattleState state, BattleAction action, Monster actor) {
        if (!state.isWildEncounter() || action.side() != Side.PLAYER) {
            return ActionOutcome.rejected(state, "이 몬스터에게는 먹이를 줄 수 없다!");
        }

        Optional<Monster> found = state.activeCombatant(Side.ENEMY);
        if (found.isEmpty() || found.get().isFainted()) {
            return ActionOutcome.noOp(state);
        }

        String treatId = normalize(action.itemId());
        Monster target = found.get();
        int raised = Math.min(MAX_AFFECTION, target.getAffection() + affectionGain(treatId, target.getPrimaryType()));
        int gained = Math.max(0, raised - target.getAffection());

        BattleState next = state.withCombatant(Side.ENEMY, state.getActiveEnemySlot(),
                target.withAffection(target.getAffection() + gained));
        log.debug("[행동] 먹이 주기: target={}, treat={}, affection {} -> {}", target.getName(), treatId,
                target.getAffection(), target.getAffection() + gained);
        return ActionOutcome.applied(next, String.format("%s은(는) %s이(가) 마음에 드는 것 같다! 호감도가 %d 올랐다.",
                target.getName(), treatName(treatId), gained));
    }

    public static int affectionGain(String treatId, MonsterType targetType) {
        String id = normalize(treatId);
        int gain = quality(id).getAffectionBonus();
        if (PREFERRED_TYPES.get(id) == targetType) {
            gain += PREFERRED_TYPE_BONUS;
        }
        return gain;
    }

    public static TreatQuality quality(String treatId) {
        return QUALITIES.getOrDefault(normalize(treatId), TreatQuality.BASIC);
    }

    static String treatName(String treatId) {
        return NAMES.getOrDefault(normalize(treatId), "Treat");
    }

    private static String normalize(String treatId) {
        return treatId == null ? DEFAULT_TREAT : treatId;
    }
}
