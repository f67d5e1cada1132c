package com.example.monsterbattle.battle.ai;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import com.example.monsterbattle.battle.domain.BattleAction;
import com.example.monsterbattle.battle.domain.Monster;
import com.example.monsterbattle.battle.domain.Side;
import com.example.monsterbattle.battle.domain.Skill;

/**
 * MP가 8 초과이고 40% 확률로 사용 가능한 스킬 중 하나를 무작위로 고른다.
 * 사용 가능한 스킬이 없으면 기본 공격.
 */
public class UseAffordableSkillRule implements DecisionRule {

    static final int MP_THRESHOLD = 8;
    static final double CHANCE = 0.4;

    @Override
    public boolean matches(DecisionContext context) {
        return context.actor().getCurrentMp() > MP_THRESHOLD && context.random().nextDouble() < CHANCE;
    }

    @Override
    public BattleAction decide(DecisionContext context) {
        List<Skill> affordable = affordableSkills(context);
        if (affordable.isEmpty()) {
            return BattleAction.attack(Side.ENEMY, context.slot());
        }
        int index = (int) Math.floor(context.random().nextDouble() * affordable.size());
        Skill chosen = affordable.get(Math.min(index, affordable.size() - 1));
        return BattleAction.useSkill(Side.ENEMY, context.slot(), chosen.getId(), chosen.getPriority());
    }

    /**
     * 몬스터가 배운 스킬 중 MP가 충분한 것. 배운 스킬 목록이 없으면 카탈로그 전체에서 고른다.
     */
    private List<Skill> affordableSkills(DecisionContext context) {
        Monster actor = context.actor();
        List<Skill> candidates = actor.getSkills().isEmpty()
                ? context.skills().findAll()
                : actor.getSkills().stream()
                        .map(context.skills()::lookup)
                        .flatMap(Optional::stream)
                        .collect(Collectors.toList());
        return candidates.stream()
                .filter(skill -> actor.getCurrentMp() >= skill.getMpCost())
                .collect(Collectors.toList());
    }
}
