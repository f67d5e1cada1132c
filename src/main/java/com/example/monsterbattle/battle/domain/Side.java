package com.example.monsterbattle.battle.domain;

public enum Side {
    PLAYER, ENEMY;

    public Side opposite() {
        return this == PLAYER ? ENEMY : PLAYER;
    }
}
