package com.example.monsterbattle.battle.support;

import java.util.ArrayList;
import java.util.List;

import com.example.monsterbattle.battle.pacing.PacingPoint;
import com.example.monsterbattle.battle.pacing.PacingScheduler;

public class RecordingPacingScheduler implements PacingScheduler {

    private final List<String> log;

    public RecordingPacingScheduler() {
        this(new ArrayList<>());
    }

    public RecordingPacingScheduler(List<String> sharedLog) {
        this.log = sharedLog;
    }

    @Override
    public void pause(PacingPoint point) {
        log.add(point.name());
    }

    public List<String> log() {
        return log;
    }
}
