package com.example.monsterbattle.battle.strategy;

import com.example.monsterbattle.battle.domain.BattleAction;
import com.example.monsterbattle.battle.domain.BattleState;
import com.example.monsterbattle.battle.domain.Monster;

/**
 * 행동 종류별 실행 전략 인터페이스 (Strategy Pattern)
 */
public interface ActionStrategy {

    /**
     * 행동 실행
     *
     * @param state  현재 배틀 상태
     * @param action 실행할 행동
     * @param actor  행동 주체 (action.side / action.actorSlot 위치의 몬스터)
     * @return 새 상태와 이벤트
     */
    ActionOutcome execute(BattleState state, BattleAction action, Monster actor);
}
