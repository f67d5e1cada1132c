package com.example.monsterbattle.global.config;

import static org.assertj.core.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.example.monsterbattle.battle.pacing.NoOpPacingScheduler;
import com.example.monsterbattle.battle.pacing.SleepingPacingScheduler;
import com.example.monsterbattle.battle.random.RandomSource;
import com.example.monsterbattle.battle.random.SeededRandomSource;

class BattleConfigTest {

    private final BattleConfig config = new BattleConfig();

    @Test
    @DisplayName("시드를 지정하면 같은 시드의 난수 열을 그대로 돌려준다")
    void seededRandomSourceFollowsSeed() {
        BattleProperties properties = new BattleProperties();
        properties.getRandom().setSeed(42L);

        RandomSource bean = config.randomSource(properties);
        RandomSource reference = new SeededRandomSource(42L);

        for (int i = 0; i < 10; i++) {
            assertThat(bean.nextDouble()).isEqualTo(reference.nextDouble());
        }
    }

    @Test
    @DisplayName("하나의 빈을 여러 배틀이 나눠 쓰면 각 배틀이 받는 값은 처리 순서에 따라 달라진다")
    void sharedSourceDependsOnGlobalOrder() {
        BattleProperties properties = new BattleProperties();
        properties.getRandom().setSeed(42L);
        RandomSource reference = new SeededRandomSource(42L);
        double first = reference.nextDouble();
        double second = reference.nextDouble();

        // 다른 배틀이 먼저 한 번 뽑은 뒤
        RandomSource shared = config.randomSource(properties);
        shared.nextDouble();

        assertThat(shared.nextDouble()).isEqualTo(second).isNotEqualTo(first);
    }

    @Test
    @DisplayName("연출 대기를 끄면 대기 없는 스케줄러를 쓴다")
    void pacingToggle() {
        BattleProperties properties = new BattleProperties();
        assertThat(config.pacingScheduler(properties)).isInstanceOf(NoOpPacingScheduler.class);

        properties.getPacing().setEnabled(true);
        assertThat(config.pacingScheduler(properties)).isInstanceOf(SleepingPacingScheduler.class);
    }
}
