package com.example.monsterbattle.battle.strategy;

import java.util.Optional;

import org.springframework.stereotype.Component;

import com.example.monsterbattle.battle.catalog.SkillCatalog;
import com.example.monsterbattle.battle.domain.BattleAction;
import com.example.monsterbattle.battle.domain.BattleState;
import com.example.monsterbattle.battle.domain.Monster;
import com.example.monsterbattle.battle.domain.Skill;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 스킬 사용 전략
 * - 알 수 없는 스킬이거나 MP가 부족하면 아무 일도 일어나지 않는다 (이벤트 없음)
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SkillAction implements ActionStrategy {

    private final SkillCatalog skillCatalog;
    private final SkillEffectApplier skillEffectApplier;

    @Override
    public ActionOutcome execute(BattleState state, BattleAction action, Monster actor) {
        Optional<Skill> found = skillCatalog.lookup(action.skillId());
        if (found.isEmpty()) {
            log.debug("[행동] 알 수 없는 스킬: skillId={}", action.skillId());
            return ActionOutcome.noOp(state);
        }

        Skill skill = found.get();
        if (actor.getCurrentMp() < skill.getMpCost()) {
            log.debug("[행동] MP 부족: actor={}, mp={}, cost={}", actor.getName(), actor.getCurrentMp(),
                    skill.getMpCost());
            return ActionOutcome.noOp(state);
        }
        return skillEffectApplier.apply(state, action, actor, skill);
    }
}
