package com.example.monsterbattle.battle.service;

import java.util.List;

import org.springframework.stereotype.Component;

import com.example.monsterbattle.battle.domain.Monster;
import com.example.monsterbattle.global.error.CommonException;
import com.example.monsterbattle.global.error.ErrorCode;

/**
 * 배틀 시작 전 파티 검증. 엔진 내부로 잘못된 입력이 들어가지 않도록 경계에서 거른다.
 */
@Component
public class BattleValidator {

    public void validateParties(List<Monster> playerParty, List<Monster> enemyParty) {
        validateParty(playerParty, "플레이어");
        validateParty(enemyParty, "적");
    }

    private void validateParty(List<Monster> party, String sideName) {
        if (party == null || party.isEmpty()) {
            throw new CommonException(ErrorCode.EMPTY_PARTY, sideName + " 파티가 비어 있습니다.");
        }
        if (party.stream().anyMatch(monster -> monster == null)) {
            throw new CommonException(ErrorCode.INVALID_MONSTER, sideName + " 파티에 빈 슬롯이 있습니다.");
        }
        if (party.stream().allMatch(Monster::isFainted)) {
            throw new CommonException(ErrorCode.INVALID_MONSTER, sideName + " 파티에 싸울 수 있는 몬스터가 없습니다.");
        }
    }
}
