package com.example.monsterbattle.battle.controller;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.example.monsterbattle.battle.domain.BattleSession;
import com.example.monsterbattle.battle.dto.request.ActionRequest;
import com.example.monsterbattle.battle.dto.request.StartBattleRequest;
import com.example.monsterbattle.battle.dto.response.BattleResponse;
import com.example.monsterbattle.battle.service.BattleService;
import com.example.monsterbattle.global.dto.CommonResponse;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RestController
@RequestMapping("/api/battles")
@RequiredArgsConstructor
public class BattleController {

    private final BattleService battleService;

    @PostMapping
    public ResponseEntity<CommonResponse<BattleResponse>> startBattle(@Valid @RequestBody StartBattleRequest request) {
        BattleSession session = battleService.startBattle(request);

        return ResponseEntity.status(HttpStatus.CREATED)
                .body(CommonResponse.success(BattleResponse.from(session), "배틀이 시작되었습니다."));
    }

    @PostMapping("/{battleId}/actions")
    public ResponseEntity<CommonResponse<BattleResponse>> submitAction(@PathVariable String battleId,
            @Valid @RequestBody ActionRequest request) {
        BattleSession session = battleService.submitAction(battleId, request);

        return ResponseEntity.ok(CommonResponse.success(BattleResponse.from(session), "턴이 처리되었습니다."));
    }

    @GetMapping("/{battleId}")
    public ResponseEntity<CommonResponse<BattleResponse>> getBattle(@PathVariable String battleId) {
        BattleSession session = battleService.getBattle(battleId);

        return ResponseEntity.ok(CommonResponse.success(BattleResponse.from(session), "배틀 상태 조회 성공"));
    }

    @DeleteMapping("/{battleId}")
    public ResponseEntity<CommonResponse<Void>> endBattle(@PathVariable String battleId) {
        battleService.endBattle(battleId);

        return ResponseEntity.ok(CommonResponse.success(null, "배틀이 종료되었습니다."));
    }
}
