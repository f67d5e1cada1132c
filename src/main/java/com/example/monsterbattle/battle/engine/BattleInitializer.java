package com.example.monsterbattle.battle.engine;

import java.util.List;

import org.springframework.stereotype.Component;

import com.example.monsterbattle.battle.domain.BattlePhase;
import com.example.monsterbattle.battle.domain.BattleState;
import com.example.monsterbattle.battle.domain.BattleType;
import com.example.monsterbattle.battle.domain.Monster;

/**
 * 새 배틀 상태 생성. 배틀 종류에 따라 도망/포획 가능 여부가 정해진다.
 */
@Component
public class BattleInitializer {

    public static final String START_EVENT = "배틀 시작!";

    public BattleState initiateBattle(List<Monster> playerParty, List<Monster> enemyParty, BattleType battleType) {
        if (playerParty == null || playerParty.isEmpty()) {
            throw new IllegalArgumentException("플레이어 파티가 비어 있습니다.");
        }
        if (enemyParty == null || enemyParty.isEmpty()) {
            throw new IllegalArgumentException("적 파티가 비어 있습니다.");
        }

        return BattleState.builder()
                .playerParty(playerParty)
                .enemyParty(enemyParty)
                .activePlayerSlot(firstStandingSlot(playerParty))
                .activeEnemySlot(firstStandingSlot(enemyParty))
                .phase(BattlePhase.SELECTING)
                .turn(1)
                .lastEvent(START_EVENT)
                .wildEncounter(battleType.isWildEncounter())
                .canFlee(battleType.isCanFlee())
                .canCapture(battleType.isCanCapture())
                .build();
    }

    private int firstStandingSlot(List<Monster> party) {
        for (int i = 0; i < party.size(); i++) {
            if (!party.get(i).isFainted()) {
                return i;
            }
        }
        return 0;
    }
}
