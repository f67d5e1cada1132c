package com.example.monsterbattle.battle.engine;

import static com.example.monsterbattle.battle.support.Monsters.*;
import static org.assertj.core.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.example.monsterbattle.battle.domain.BattleAction;
import com.example.monsterbattle.battle.domain.BattleState;
import com.example.monsterbattle.battle.domain.BattleType;
import com.example.monsterbattle.battle.domain.Side;

class TurnOrderResolverTest {

    private final TurnOrderResolver resolver = new TurnOrderResolver();
    private final BattleInitializer initializer = new BattleInitializer();

    private BattleState battle(int playerAgility, int enemyAgility) {
        return initializer.initiateBattle(
                List.of(monster("Player").stats(agility(playerAgility)).build()),
                List.of(monster("Enemy").stats(agility(enemyAgility)).build()),
                BattleType.TRAINER_BATTLE);
    }

    @Test
    @DisplayName("우선도가 같으면 민첩이 높은 쪽이 먼저 행동한다")
    void fasterActsFirst() {
        // given
        BattleState state = battle(50, 70);
        BattleAction player = BattleAction.attack(Side.PLAYER, 0);
        BattleAction enemy = BattleAction.attack(Side.ENEMY, 0);

        // when
        List<BattleAction> ordered = resolver.order(state, player, enemy);

        // then
        assertThat(ordered).containsExactly(enemy, player);
    }

    @Test
    @DisplayName("우선도 1은 민첩 차이와 관계없이 먼저 행동한다")
    void priorityBeatsAgility() {
        BattleState state = battle(10, 200);
        BattleAction player = BattleAction.defend(Side.PLAYER, 0, 1);
        BattleAction enemy = BattleAction.attack(Side.ENEMY, 0);

        List<BattleAction> ordered = resolver.order(state, player, enemy);

        assertThat(ordered).containsExactly(player, enemy);
        assertThat(resolver.orderKey(state, player)).isEqualTo(1010);
        assertThat(resolver.orderKey(state, enemy)).isEqualTo(200);
    }

    @Test
    @DisplayName("정렬 키가 같으면 제출 순서를 유지한다")
    void tiesKeepSubmissionOrder() {
        BattleState state = battle(50, 50);
        BattleAction player = BattleAction.attack(Side.PLAYER, 0);
        BattleAction enemy = BattleAction.attack(Side.ENEMY, 0);

        assertThat(resolver.order(state, player, enemy)).containsExactly(player, enemy);
        assertThat(resolver.order(state, enemy, player)).containsExactly(enemy, player);
    }

    @Test
    @DisplayName("존재하지 않는 슬롯의 행동은 민첩 0으로 취급한다")
    void missingActorCountsAsZeroAgility() {
        BattleState state = battle(50, 50);

        assertThat(resolver.orderKey(state, BattleAction.attack(Side.PLAYER, 5))).isZero();
    }
}
