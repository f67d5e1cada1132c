package com.example.monsterbattle.battle.strategy;

import java.util.ArrayList;
import java.util.List;

import org.springframework.stereotype.Component;

import com.example.monsterbattle.battle.domain.BattleAction;
import com.example.monsterbattle.battle.domain.BattleState;
import com.example.monsterbattle.battle.domain.Monster;
import com.example.monsterbattle.battle.domain.Side;
import com.example.monsterbattle.battle.domain.Skill;
import com.example.monsterbattle.battle.engine.DamageCalculator;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 기본 공격과 스킬이 공유하는 효과 적용 루틴.
 * - 데미지 스킬: 대상 HP 감소 (방어 중이면 절반, 최소 1)
 * - 회복 스킬: 대상 HP 회복 (최대 HP까지)
 * - 그 외 (power 0, 보조): 데미지 계산을 거치지 않음
 * MP 소모는 효과 적용 후 행동 주체에 반영한다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SkillEffectApplier {

    private final DamageCalculator damageCalculator;

    public ActionOutcome apply(BattleState state, BattleAction action, Monster actor, Skill skill) {
        List<Target> targets = resolveTargets(state, action, skill);

        BattleState next = state;
        List<String> parts = new ArrayList<>();

        if (skill.isDamaging()) {
            for (Target t : targets) {
                Monster target = next.party(t.side()).get(t.slot());
                int damage = damageCalculator.computeDamage(actor, target, skill, skill.isPhysical());
                if (target.isDefending()) {
                    damage = Math.max(1, damage / 2);
                }
                next = next.withCombatant(t.side(), t.slot(), target.takeDamage(damage));
                parts.add(String.format("%s에게 %d의 데미지!", target.getName(), damage));
                log.debug("[행동] {} -> {} {} 데미지 (skill={})", actor.getName(), target.getName(), damage,
                        skill.getId());
            }
        } else if (skill.isHealing()) {
            int amount = Math.max(1, actor.getStats().getMagic() * skill.getPower() / 100);
            for (Target t : targets) {
                Monster target = next.party(t.side()).get(t.slot());
                Monster healed = target.heal(amount);
                next = next.withCombatant(t.side(), t.slot(), healed);
                parts.add(String.format("%s의 HP가 %d 회복되었다!", target.getName(),
                        healed.getCurrentHp() - target.getCurrentHp()));
            }
        }

        // 회복 대상이 자기 자신일 수 있으므로 최신 상태에서 다시 읽는다
        next = next.updateCombatant(action.side(), action.actorSlot(), m -> m.spendMp(skill.getMpCost()));

        String message = String.format("%s의 %s!", actor.getName(), skill.getName());
        if (!parts.isEmpty()) {
            message = message + " " + String.join(" ", parts);
        }
        return ActionOutcome.applied(next, message);
    }

    /**
     * ALL 은 상대 진영 → 자기 진영 순으로 살아있는 모든 몬스터 (행동 주체 포함)
     */
    private List<Target> resolveTargets(BattleState state, BattleAction action, Skill skill) {
        Side own = action.side();
        Side opposing = own.opposite();
        List<Target> targets = new ArrayList<>();
        switch (skill.getTarget()) {
            case SELF -> targets.add(new Target(own, action.actorSlot()));
            case SINGLE_ENEMY -> addActive(state, opposing, targets);
            case SINGLE_ALLY -> addActive(state, own, targets);
            case ALL_ENEMIES -> addLiving(state, opposing, targets);
            case ALL_ALLIES -> addLiving(state, own, targets);
            case ALL -> {
                addLiving(state, opposing, targets);
                addLiving(state, own, targets);
            }
        }
        return targets;
    }

    private void addActive(BattleState state, Side side, List<Target> targets) {
        int slot = state.activeSlot(side);
        if (state.combatant(side, slot).isPresent()) {
            targets.add(new Target(side, slot));
        }
    }

    private void addLiving(BattleState state, Side side, List<Target> targets) {
        List<Monster> party = state.party(side);
        for (int i = 0; i < party.size(); i++) {
            if (!party.get(i).isFainted()) {
                targets.add(new Target(side, i));
            }
        }
    }

    private record Target(Side side, int slot) {
    }
}
