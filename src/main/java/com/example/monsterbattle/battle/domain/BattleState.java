package com.example.monsterbattle.battle.domain;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

import lombok.Builder;
import lombok.Value;

/**
 * 배틀 상태 스냅샷 (불변).
 *
 * <p>모든 단계는 기존 상태를 수정하지 않고 새 인스턴스를 반환한다.
 * 파티 내 몬스터는 값 비교가 아닌 슬롯 인덱스로만 참조한다.
 */
@Value
public class BattleState {

    List<Monster> playerParty;
    List<Monster> enemyParty;
    int activePlayerSlot;
    int activeEnemySlot;
    BattlePhase phase;
    int turn;
    String lastEvent;
    boolean wildEncounter;
    boolean canFlee;
    boolean canCapture;
    Integer recruitedEnemySlot;

    @Builder(toBuilder = true)
    public BattleState(List<Monster> playerParty, List<Monster> enemyParty, int activePlayerSlot,
            int activeEnemySlot, BattlePhase phase, int turn, String lastEvent, boolean wildEncounter,
            boolean canFlee, boolean canCapture, Integer recruitedEnemySlot) {
        this.playerParty = List.copyOf(playerParty);
        this.enemyParty = List.copyOf(enemyParty);
        this.activePlayerSlot = activePlayerSlot;
        this.activeEnemySlot = activeEnemySlot;
        this.phase = phase == null ? BattlePhase.SELECTING : phase;
        this.turn = turn;
        this.lastEvent = lastEvent;
        this.wildEncounter = wildEncounter;
        this.canFlee = canFlee;
        this.canCapture = canCapture;
        this.recruitedEnemySlot = recruitedEnemySlot;
    }

    public List<Monster> party(Side side) {
        return side == Side.PLAYER ? playerParty : enemyParty;
    }

    public int activeSlot(Side side) {
        return side == Side.PLAYER ? activePlayerSlot : activeEnemySlot;
    }

    public Optional<Monster> combatant(Side side, int slot) {
        List<Monster> party = party(side);
        if (slot < 0 || slot >= party.size()) {
            return Optional.empty();
        }
        return Optional.of(party.get(slot));
    }

    public Optional<Monster> activeCombatant(Side side) {
        return combatant(side, activeSlot(side));
    }

    /**
     * 해당 진영의 모든 몬스터가 쓰러졌는지 확인
     */
    public boolean isSideDefeated(Side side) {
        return party(side).stream().allMatch(Monster::isFainted);
    }

    /**
     * 지정 슬롯의 몬스터를 교체한 새 상태를 반환한다. 범위 밖 슬롯이면 그대로 반환.
     */
    public BattleState withCombatant(Side side, int slot, Monster monster) {
        return updateCombatant(side, slot, ignored -> monster);
    }

    public BattleState updateCombatant(Side side, int slot, UnaryOperator<Monster> updater) {
        List<Monster> party = party(side);
        if (slot < 0 || slot >= party.size()) {
            return this;
        }
        List<Monster> updated = new ArrayList<>(party);
        updated.set(slot, updater.apply(party.get(slot)));
        BattleStateBuilder builder = toBuilder();
        if (side == Side.PLAYER) {
            builder.playerParty(updated);
        } else {
            builder.enemyParty(updated);
        }
        return builder.build();
    }

    public BattleState withActiveSlot(Side side, int slot) {
        return side == Side.PLAYER
                ? toBuilder().activePlayerSlot(slot).build()
                : toBuilder().activeEnemySlot(slot).build();
    }

    public BattleState withPhase(BattlePhase newPhase) {
        return toBuilder().phase(newPhase).build();
    }
}
