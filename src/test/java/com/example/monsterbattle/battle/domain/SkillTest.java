package com.example.monsterbattle.battle.domain;

import static org.assertj.core.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class SkillTest {

    private Skill.SkillBuilder tackle() {
        return Skill.builder().id("tackle").name("Tackle")
                .category(SkillCategory.PHYSICAL).target(SkillTarget.SINGLE_ENEMY)
                .mpCost(0).power(40);
    }

    @Test
    @DisplayName("명중률을 지정하지 않으면 100")
    void accuracyDefaultsToHundred() {
        assertThat(tackle().build().getAccuracy()).isEqualTo(100);
    }

    @Test
    @DisplayName("음수 MP 소모량은 거부된다")
    void negativeMpCostIsRejected() {
        assertThatThrownBy(() -> tackle().mpCost(-3).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("mpCost=-3");
    }

    @Test
    @DisplayName("음수 위력은 거부된다")
    void negativePowerIsRejected() {
        assertThatThrownBy(() -> tackle().power(-1).build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("명중률은 0 ~ 100 범위여야 한다")
    void accuracyOutOfRangeIsRejected() {
        assertThatThrownBy(() -> tackle().accuracy(101).build()).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> tackle().accuracy(-1).build()).isInstanceOf(IllegalArgumentException.class);
        assertThat(tackle().accuracy(0).build().getAccuracy()).isZero();
    }

    @Test
    @DisplayName("대상 없는 스킬은 만들 수 없다")
    void targetIsRequired() {
        assertThatThrownBy(() -> tackle().target(null).build()).isInstanceOf(NullPointerException.class);
    }
}
