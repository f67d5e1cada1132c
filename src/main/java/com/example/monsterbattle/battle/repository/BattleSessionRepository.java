package com.example.monsterbattle.battle.repository;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import org.springframework.stereotype.Repository;

import com.example.monsterbattle.battle.domain.BattleSession;

import lombok.extern.slf4j.Slf4j;

/**
 * 진행 중인 배틀 세션 저장소 (메모리)
 */
@Slf4j
@Repository
public class BattleSessionRepository {

    private final Map<String, BattleSession> sessions = new ConcurrentHashMap<>();

    public void save(BattleSession session) {
        sessions.put(session.getBattleId(), session);
    }

    public Optional<BattleSession> findById(String battleId) {
        if (battleId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(sessions.get(battleId));
    }

    public List<BattleSession> findAll() {
        return List.copyOf(sessions.values());
    }

    public void delete(String battleId) {
        if (sessions.remove(battleId) != null) {
            log.debug("[세션] 삭제: battleId={}", battleId);
        }
    }

    public int count() {
        return sessions.size();
    }
}
