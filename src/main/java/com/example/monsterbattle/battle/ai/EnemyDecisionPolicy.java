package com.example.monsterbattle.battle.ai;

import java.util.List;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import com.example.monsterbattle.battle.catalog.SkillCatalog;
import com.example.monsterbattle.battle.domain.BattleAction;
import com.example.monsterbattle.battle.domain.BattleState;
import com.example.monsterbattle.battle.domain.Monster;
import com.example.monsterbattle.battle.domain.Side;
import com.example.monsterbattle.battle.random.RandomSource;

import lombok.extern.slf4j.Slf4j;

/**
 * 적 행동 결정 정책.
 * 규칙 목록을 순서대로 평가한다: 스킬 사용 → 저체력 방어 → 기본 공격
 */
@Slf4j
@Component
public class EnemyDecisionPolicy {

    private final SkillCatalog skillCatalog;
    private final RandomSource randomSource;
    private final List<DecisionRule> rules;

    @Autowired
    public EnemyDecisionPolicy(SkillCatalog skillCatalog, RandomSource randomSource) {
        this(skillCatalog, randomSource, defaultRules());
    }

    public EnemyDecisionPolicy(SkillCatalog skillCatalog, RandomSource randomSource, List<DecisionRule> rules) {
        this.skillCatalog = skillCatalog;
        this.randomSource = randomSource;
        this.rules = List.copyOf(rules);
    }

    public static List<DecisionRule> defaultRules() {
        return List.of(new UseAffordableSkillRule(), new LowHpDefendRule(), new AttackRule());
    }

    public BattleAction decideEnemyAction(BattleState state) {
        int slot = state.getActiveEnemySlot();
        Monster actor = state.activeCombatant(Side.ENEMY)
                .orElseThrow(() -> new IllegalStateException("활성 적 몬스터가 없습니다: slot=" + slot));

        DecisionContext context = new DecisionContext(state, actor, slot, randomSource, skillCatalog);
        for (DecisionRule rule : rules) {
            if (rule.matches(context)) {
                BattleAction action = rule.decide(context);
                log.debug("[AI] {} 행동 결정: kind={}, skillId={}", actor.getName(), action.kind(), action.skillId());
                return action;
            }
        }
        return BattleAction.attack(Side.ENEMY, slot);
    }
}
