package com.example.monsterbattle.battle.strategy;

import org.springframework.stereotype.Component;

import com.example.monsterbattle.battle.domain.ActionKind;

import lombok.RequiredArgsConstructor;

/**
 * 행동 종류별 전략을 제공하는 Factory
 */
@Component
@RequiredArgsConstructor
public class ActionStrategyFactory {

    private final AttackAction attackAction;
    private final SkillAction skillAction;
    private final DefendAction defendAction;
    private final FleeAction fleeAction;
    private final CaptureAction captureAction;
    private final TreatAction treatAction;

    /**
     * 행동 종류에 맞는 전략 반환
     */
    public ActionStrategy getStrategy(ActionKind kind) {
        return switch (kind) {
            case ATTACK -> attackAction;
            case USE_SKILL -> skillAction;
            case DEFEND -> defendAction;
            case FLEE -> fleeAction;
            case CAPTURE -> captureAction;
            case TREAT -> treatAction;
        };
    }
}
