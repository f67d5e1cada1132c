package com.example.monsterbattle.battle.ai;

import com.example.monsterbattle.battle.catalog.SkillCatalog;
import com.example.monsterbattle.battle.domain.BattleState;
import com.example.monsterbattle.battle.domain.Monster;
import com.example.monsterbattle.battle.random.RandomSource;

/**
 * 적 행동 결정 시 규칙에 전달되는 정보
 *
 * @param state  현재 배틀 상태
 * @param actor  행동할 적 몬스터
 * @param slot   적 파티 내 슬롯
 * @param random 난수 공급원
 * @param skills 스킬 카탈로그
 */
public record DecisionContext(
        BattleState state,
        Monster actor,
        int slot,
        RandomSource random,
        SkillCatalog skills) {
}
