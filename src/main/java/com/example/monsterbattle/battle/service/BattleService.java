package com.example.monsterbattle.battle.service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Random;
import java.util.stream.Collectors;

import org.springframework.stereotype.Service;

import com.example.monsterbattle.battle.ai.EnemyDecisionPolicy;
import com.example.monsterbattle.battle.catalog.SkillCatalog;
import com.example.monsterbattle.battle.domain.ActionKind;
import com.example.monsterbattle.battle.domain.BattleAction;
import com.example.monsterbattle.battle.domain.BattleSession;
import com.example.monsterbattle.battle.domain.BattleState;
import com.example.monsterbattle.battle.domain.BattleType;
import com.example.monsterbattle.battle.domain.Monster;
import com.example.monsterbattle.battle.domain.Side;
import com.example.monsterbattle.battle.domain.Skill;
import com.example.monsterbattle.battle.domain.TurnResult;
import com.example.monsterbattle.battle.dto.request.ActionRequest;
import com.example.monsterbattle.battle.dto.request.MonsterRequest;
import com.example.monsterbattle.battle.dto.request.StartBattleRequest;
import com.example.monsterbattle.battle.engine.BattleInitializer;
import com.example.monsterbattle.battle.engine.BattleStateMachine;
import com.example.monsterbattle.battle.repository.BattleSessionRepository;
import com.example.monsterbattle.global.error.CommonException;
import com.example.monsterbattle.global.error.ErrorCode;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 배틀 세션 서비스
 * - 배틀 시작 / 플레이어 행동 제출 / 조회 / 종료
 * - 턴 처리, 세션 종료, 세션 정리는 같은 모니터로 직렬화한다
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BattleService {

    private final BattleSessionRepository battleSessionRepository;
    private final BattleValidator battleValidator;
    private final BattleInitializer battleInitializer;
    private final BattleStateMachine battleStateMachine;
    private final EnemyDecisionPolicy enemyDecisionPolicy;
    private final SkillCatalog skillCatalog;

    // ==================== 배틀 생성 ====================

    public BattleSession startBattle(StartBattleRequest request) {
        List<Monster> playerParty = toMonsters(request.playerParty());
        List<Monster> enemyParty = toMonsters(request.enemyParty());
        return startBattle(playerParty, enemyParty, request.battleType());
    }

    public BattleSession startBattle(List<Monster> playerParty, List<Monster> enemyParty, BattleType battleType) {
        battleValidator.validateParties(playerParty, enemyParty);
        if (battleType == null) {
            throw new CommonException(ErrorCode.INVALID_REQUEST, "배틀 종류가 없습니다.");
        }

        String battleId = "battle_" + System.currentTimeMillis() + "_" + new Random().nextInt(1000);
        BattleState state = battleInitializer.initiateBattle(playerParty, enemyParty, battleType);

        Instant now = Instant.now();
        BattleSession session = BattleSession.builder()
                .battleId(battleId)
                .battleType(battleType)
                .state(state)
                .lastEvents(List.of(state.getLastEvent()))
                .createdAt(now)
                .updatedAt(now)
                .build();
        battleSessionRepository.save(session);

        log.info("[배틀] 시작: battleId={}, type={}, player={}, enemy={}", battleId, battleType,
                playerParty.size(), enemyParty.size());
        return session;
    }

    // ==================== 턴 진행 ====================

    public synchronized BattleSession submitAction(String battleId, ActionRequest request) {
        BattleSession session = getBattle(battleId);
        if (session.isFinished()) {
            log.warn("[배틀] 종료된 배틀에 행동 제출: battleId={}, phase={}", battleId, session.getState().getPhase());
            throw ErrorCode.BATTLE_ALREADY_FINISHED.commonException();
        }

        BattleState state = session.getState();
        BattleAction playerAction = toPlayerAction(state, request);
        BattleAction enemyAction = enemyDecisionPolicy.decideEnemyAction(state);

        TurnResult result = battleStateMachine.resolveTurn(state, playerAction, enemyAction);

        BattleSession updated = session.toBuilder()
                .state(result.state())
                .lastEvents(result.events())
                .updatedAt(Instant.now())
                .build();
        battleSessionRepository.save(updated);

        if (updated.isFinished()) {
            log.info("[배틀] 결과: battleId={}, phase={}, turn={}", battleId, result.state().getPhase(),
                    result.state().getTurn());
        }
        return updated;
    }

    // ==================== 조회 / 종료 ====================

    public BattleSession getBattle(String battleId) {
        return battleSessionRepository.findById(battleId)
                .orElseThrow(() -> new CommonException(ErrorCode.BATTLE_NOT_FOUND, battleId));
    }

    public synchronized void endBattle(String battleId) {
        getBattle(battleId);
        battleSessionRepository.delete(battleId);
        log.info("[배틀] 세션 종료: battleId={}", battleId);
    }

    /**
     * 종료된 배틀 및 TTL 동안 갱신되지 않은 배틀 삭제
     *
     * @return 삭제된 세션 수
     */
    public synchronized int evictStaleSessions(Instant now, Duration ttl) {
        int evicted = 0;
        for (BattleSession session : battleSessionRepository.findAll()) {
            boolean expired = session.getUpdatedAt().plus(ttl).isBefore(now);
            if (session.isFinished() || expired) {
                battleSessionRepository.delete(session.getBattleId());
                evicted++;
            }
        }
        return evicted;
    }

    // ==================== 변환 헬퍼 ====================

    private List<Monster> toMonsters(List<MonsterRequest> requests) {
        if (requests == null) {
            return List.of();
        }
        try {
            return requests.stream().map(MonsterRequest::toMonster).collect(Collectors.toList());
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new CommonException(ErrorCode.INVALID_MONSTER, e.getMessage());
        }
    }

    private BattleAction toPlayerAction(BattleState state, ActionRequest request) {
        int active = state.getActivePlayerSlot();
        if (request.actorSlot() != null && request.actorSlot() != active) {
            throw new CommonException(ErrorCode.INVALID_REQUEST,
                    "활성 몬스터만 행동할 수 있습니다: actorSlot=" + request.actorSlot() + ", active=" + active);
        }
        return new BattleAction(request.kind(), Side.PLAYER, active, request.skillId(), request.itemId(),
                defaultPriority(request));
    }

    private int defaultPriority(ActionRequest request) {
        if (request.kind() != ActionKind.USE_SKILL) {
            return 0;
        }
        return skillCatalog.lookup(request.skillId()).map(Skill::getPriority).orElse(0);
    }
}
