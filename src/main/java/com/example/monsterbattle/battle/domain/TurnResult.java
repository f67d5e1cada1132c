package com.example.monsterbattle.battle.domain;

import java.util.List;

/**
 * 한 턴 처리 결과
 *
 * @param state  턴 종료 후 상태
 * @param events 적용된 순서대로 쌓인 이벤트 메시지
 */
public record TurnResult(BattleState state, List<String> events) {

    public TurnResult {
        events = List.copyOf(events);
    }
}
