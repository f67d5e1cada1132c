package com.example.monsterbattle.battle.domain;

import java.util.Objects;

/**
 * 한 턴에 제출되는 행동. {@link ActionKind}로 구분되는 닫힌 합 타입이며
 * 행동 주체는 파티 내 슬롯 인덱스로 참조한다.
 *
 * @param kind      행동 종류
 * @param side      행동 주체의 진영
 * @param actorSlot 행동 주체의 파티 슬롯
 * @param skillId   USE_SKILL 일 때만 사용
 * @param itemId    CAPTURE 의 포획 아이템, TREAT 의 먹이 종류
 * @param priority  우선도 (높을수록 먼저 행동)
 */
public record BattleAction(
        ActionKind kind,
        Side side,
        int actorSlot,
        String skillId,
        String itemId,
        int priority) {

    public BattleAction {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(side, "side");
    }

    public static BattleAction attack(Side side, int actorSlot) {
        return new BattleAction(ActionKind.ATTACK, side, actorSlot, null, null, 0);
    }

    public static BattleAction useSkill(Side side, int actorSlot, String skillId, int priority) {
        return new BattleAction(ActionKind.USE_SKILL, side, actorSlot, skillId, null, priority);
    }

    public static BattleAction defend(Side side, int actorSlot) {
        return defend(side, actorSlot, 0);
    }

    public static BattleAction defend(Side side, int actorSlot, int priority) {
        return new BattleAction(ActionKind.DEFEND, side, actorSlot, null, null, priority);
    }

    public static BattleAction flee(Side side, int actorSlot) {
        return new BattleAction(ActionKind.FLEE, side, actorSlot, null, null, 0);
    }

    public static BattleAction capture(Side side, int actorSlot, String itemId) {
        return new BattleAction(ActionKind.CAPTURE, side, actorSlot, null, itemId, 0);
    }

    public static BattleAction treat(Side side, int actorSlot, String treatId) {
        return new BattleAction(ActionKind.TREAT, side, actorSlot, null, treatId, 0);
    }
}
