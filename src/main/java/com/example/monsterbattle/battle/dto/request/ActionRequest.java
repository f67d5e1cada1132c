package com.example.monsterbattle.battle.dto.request;

import com.example.monsterbattle.battle.domain.ActionKind;

import jakarta.validation.constraints.NotNull;

/**
 * 플레이어 행동 요청.
 * actorSlot 은 생략하거나 현재 활성 슬롯이어야 한다. 우선도는 서버가 스킬 정의로 정한다.
 * itemId 는 CAPTURE 의 포획 아이템 또는 TREAT 의 먹이 종류.
 */
public record ActionRequest(
        @NotNull(message = "행동 종류는 필수입니다.") ActionKind kind,
        Integer actorSlot,
        String skillId,
        String itemId) {
}
