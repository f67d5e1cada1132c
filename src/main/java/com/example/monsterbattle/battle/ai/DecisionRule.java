package com.example.monsterbattle.battle.ai;

import com.example.monsterbattle.battle.domain.BattleAction;

/**
 * 적 행동 결정 규칙 (조건 + 행동 생성)
 * 규칙은 순서대로 평가되며 처음 조건을 만족한 규칙이 행동을 만든다.
 */
public interface DecisionRule {

    /**
     * 규칙 적용 여부. 난수를 소비할 수 있으므로 규칙당 한 번만 호출한다.
     */
    boolean matches(DecisionContext context);

    BattleAction decide(DecisionContext context);
}
