package com.example.monsterbattle.battle.controller;

import static com.example.monsterbattle.battle.support.Monsters.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.willThrow;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import com.example.monsterbattle.battle.domain.BattleSession;
import com.example.monsterbattle.battle.domain.BattleState;
import com.example.monsterbattle.battle.domain.BattleType;
import com.example.monsterbattle.battle.dto.request.StartBattleRequest;
import com.example.monsterbattle.battle.engine.BattleInitializer;
import com.example.monsterbattle.battle.service.BattleService;
import com.example.monsterbattle.global.error.CommonException;
import com.example.monsterbattle.global.error.ErrorCode;

@WebMvcTest(BattleController.class)
class BattleControllerTest {

    private static final String MONSTER_JSON = """
            {"id":"%s","name":"%s","level":10,"primaryType":"FIRE","currentHp":100,"maxHp":100,
             "currentMp":20,"maxMp":20,"attack":50,"defense":50,"agility":50,"magic":50,"wisdom":50}
            """;

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private BattleService battleService;

    private BattleSession session() {
        BattleState state = new BattleInitializer().initiateBattle(
                List.of(monster("Sparky").build()), List.of(monster("Wildling").build()), BattleType.WILD_ENCOUNTER);
        Instant now = Instant.now();
        return BattleSession.builder()
                .battleId("battle_1")
                .battleType(BattleType.WILD_ENCOUNTER)
                .state(state)
                .lastEvents(List.of(state.getLastEvent()))
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    @Test
    @DisplayName("배틀 시작 요청은 201과 배틀 상태를 돌려준다")
    void startBattle() throws Exception {
        given(battleService.startBattle(any(StartBattleRequest.class))).willReturn(session());
        String body = "{\"playerParty\":[" + MONSTER_JSON.formatted("p1", "Sparky") + "],"
                + "\"enemyParty\":[" + MONSTER_JSON.formatted("e1", "Wildling") + "],"
                + "\"battleType\":\"WILD_ENCOUNTER\"}";

        mockMvc.perform(post("/api/battles").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.battleId").value("battle_1"))
                .andExpect(jsonPath("$.data.state.turn").value(1))
                .andExpect(jsonPath("$.data.events[0]").value("배틀 시작!"));
    }

    @Test
    @DisplayName("빈 파티 요청은 400 INVALID_REQUEST")
    void emptyPartyFailsValidation() throws Exception {
        String body = "{\"playerParty\":[],\"enemyParty\":[],\"battleType\":\"WILD_ENCOUNTER\"}";

        mockMvc.perform(post("/api/battles").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_REQUEST"));
    }

    @Test
    @DisplayName("행동 종류가 없는 요청은 400")
    void actionKindIsRequired() throws Exception {
        mockMvc.perform(post("/api/battles/battle_1/actions").contentType(MediaType.APPLICATION_JSON).content("{}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("행동 제출은 처리된 턴의 상태를 돌려준다")
    void submitAction() throws Exception {
        given(battleService.submitAction(eq("battle_1"), any())).willReturn(session());

        mockMvc.perform(post("/api/battles/battle_1/actions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"kind\":\"ATTACK\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("턴이 처리되었습니다."));
    }

    @Test
    @DisplayName("없는 배틀 조회는 404 BATTLE_NOT_FOUND")
    void battleNotFound() throws Exception {
        given(battleService.getBattle("missing")).willThrow(new CommonException(ErrorCode.BATTLE_NOT_FOUND, "missing"));

        mockMvc.perform(get("/api/battles/missing"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("BATTLE_NOT_FOUND"));
    }

    @Test
    @DisplayName("종료된 배틀에 행동을 제출하면 409")
    void battleAlreadyFinished() throws Exception {
        willThrow(ErrorCode.BATTLE_ALREADY_FINISHED.commonException())
                .given(battleService).submitAction(eq("battle_1"), any());

        mockMvc.perform(post("/api/battles/battle_1/actions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"kind\":\"FLEE\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("BATTLE_ALREADY_FINISHED"));
    }

    @Test
    @DisplayName("배틀 종료 요청")
    void endBattle() throws Exception {
        mockMvc.perform(delete("/api/battles/battle_1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true));
    }
}
