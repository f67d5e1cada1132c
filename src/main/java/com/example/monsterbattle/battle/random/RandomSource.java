package com.example.monsterbattle.battle.random;

/**
 * 배틀에서 사용하는 난수 공급원.
 * 테스트에서는 시드 고정 또는 미리 정한 값을 돌려주는 구현으로 교체한다.
 */
public interface RandomSource {

    /**
     * @return [0, 1) 범위의 균등 분포 난수
     */
    double nextDouble();
}
