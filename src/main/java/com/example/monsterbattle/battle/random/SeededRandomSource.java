package com.example.monsterbattle.battle.random;

import java.util.Random;

public class SeededRandomSource implements RandomSource {

    private final Random random;

    public SeededRandomSource() {
        this.random = new Random();
    }

    public SeededRandomSource(long seed) {
        this.random = new Random(seed);
    }

    @Override
    public double nextDouble() {
        return random.nextDouble();
    }
}
