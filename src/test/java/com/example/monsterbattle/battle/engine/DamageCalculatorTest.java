package com.example.monsterbattle.battle.engine;

import static com.example.monsterbattle.battle.support.Monsters.*;
import static org.assertj.core.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.example.monsterbattle.battle.domain.Monster;
import com.example.monsterbattle.battle.domain.MonsterType;
import com.example.monsterbattle.battle.domain.Skill;
import com.example.monsterbattle.battle.domain.SkillCategory;
import com.example.monsterbattle.battle.domain.SkillTarget;
import com.example.monsterbattle.battle.support.ScriptedRandomSource;

class DamageCalculatorTest {

    private static final Skill STRIKE = Skill.builder()
            .id("strike").name("Strike")
            .category(SkillCategory.PHYSICAL).target(SkillTarget.SINGLE_ENEMY)
            .mpCost(0).power(80)
            .build();

    private static final Skill BOLT = Skill.builder()
            .id("bolt").name("Bolt")
            .category(SkillCategory.MAGICAL).target(SkillTarget.SINGLE_ENEMY)
            .mpCost(5).power(75)
            .build();

    private final Monster attacker = monster("Attacker").level(10).stats(stats(60, 50, 50, 50, 50)).build();
    private final Monster defender = monster("Defender").level(8).stats(stats(50, 40, 50, 50, 50)).build();

    @Test
    @DisplayName("치명타 없음, 난수보정 1.0이면 레벨 보정만 적용된다")
    void levelAdvantageWithoutCritical() {
        // given
        DamageCalculator calculator = new DamageCalculator(ScriptedRandomSource.of(0.99, 0.5));

        // when
        int damage = calculator.computeDamage(attacker, defender, STRIKE, true);

        // then: 48 * 1.1 = 52.8
        assertThat(damage).isEqualTo(52);
    }

    @Test
    @DisplayName("불 → 풀 공격은 1.5배")
    void fireAgainstGrass() {
        // given
        DamageCalculator calculator = new DamageCalculator(ScriptedRandomSource.of(0.99, 0.5));
        Monster fire = attacker.withPrimaryType(MonsterType.FIRE);
        Monster grass = defender.withPrimaryType(MonsterType.GRASS);

        // when
        int damage = calculator.computeDamage(fire, grass, STRIKE, true);

        // then: 48 * 1.1 * 1.5 = 79.2
        assertThat(damage).isEqualTo(79);
    }

    @Test
    @DisplayName("첫 난수가 0.05 미만이면 치명타 1.5배")
    void criticalHit() {
        DamageCalculator calculator = new DamageCalculator(ScriptedRandomSource.of(0.01, 0.5));

        int damage = calculator.computeDamage(attacker, defender, STRIKE, true);

        assertThat(damage).isEqualTo(79);
    }

    @Test
    @DisplayName("마법 스킬은 공격력이 아니라 마력을 사용한다")
    void magicalUsesMagicStat() {
        // given
        DamageCalculator calculator = new DamageCalculator(ScriptedRandomSource.of(0.99, 0.5));
        Monster caster = monster("Caster").stats(stats(10, 50, 50, 100, 50)).build();
        Monster target = monster("Target").build();

        // when
        int damage = calculator.computeDamage(caster, target, BOLT, false);

        // then: 100 * 75 / 100
        assertThat(damage).isEqualTo(75);
    }

    @Test
    @DisplayName("계산 결과가 0 이하이면 최소 1")
    void minimumDamageIsOne() {
        DamageCalculator calculator = new DamageCalculator(ScriptedRandomSource.of(0.99, 0.0));
        Monster weakling = monster("Weakling").level(1).stats(stats(1, 1, 1, 1, 1)).build();
        Monster giant = monster("Giant").level(50).build();

        int damage = calculator.computeDamage(weakling, giant, STRIKE, true);

        assertThat(damage).isEqualTo(1);
    }

    @Test
    @DisplayName("난수보정은 0.85 ~ 1.15 범위")
    void varianceBounds() {
        Skill full = Skill.builder()
                .id("full").name("Full")
                .category(SkillCategory.PHYSICAL).target(SkillTarget.SINGLE_ENEMY)
                .power(100)
                .build();
        Monster hitter = monster("Hitter").stats(stats(100, 50, 50, 50, 50)).build();
        Monster dummy = monster("Dummy").build();

        int low = new DamageCalculator(ScriptedRandomSource.of(0.99, 0.0)).computeDamage(hitter, dummy, full, true);
        int high = new DamageCalculator(ScriptedRandomSource.of(0.99, 0.999)).computeDamage(hitter, dummy, full, true);

        assertThat(low).isEqualTo(85);
        assertThat(high).isEqualTo(114);
    }

    @Test
    @DisplayName("보조 타입은 상성 계산에 쓰이지 않는다")
    void secondaryTypeIsIgnored() {
        DamageCalculator calculator = new DamageCalculator(ScriptedRandomSource.of(0.99, 0.5));
        Monster fire = attacker.withPrimaryType(MonsterType.FIRE);
        Monster mixed = defender.withPrimaryType(MonsterType.NORMAL).withSecondaryType(MonsterType.GRASS);

        int damage = calculator.computeDamage(fire, mixed, STRIKE, true);

        assertThat(damage).isEqualTo(52);
    }

    @Test
    @DisplayName("난수는 치명타 판정과 난수보정으로 정확히 두 번 사용한다")
    void drawsTwicePerHit() {
        ScriptedRandomSource random = ScriptedRandomSource.of(0.99, 0.5);

        new DamageCalculator(random).computeDamage(attacker, defender, STRIKE, true);

        assertThat(random.draws()).isEqualTo(2);
        assertThat(random.remaining()).isZero();
    }
}
