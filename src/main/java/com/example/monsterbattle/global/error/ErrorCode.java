package com.example.monsterbattle.global.error;

import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public enum ErrorCode {
    BATTLE_NOT_FOUND(HttpStatus.NOT_FOUND, "BATTLE_NOT_FOUND", "Battle Not Found"),
    BATTLE_ALREADY_FINISHED(HttpStatus.CONFLICT, "BATTLE_ALREADY_FINISHED", "Battle Already Finished"),
    EMPTY_PARTY(HttpStatus.BAD_REQUEST, "EMPTY_PARTY", "Party Must Not Be Empty"),
    INVALID_MONSTER(HttpStatus.BAD_REQUEST, "INVALID_MONSTER", "Invalid Monster"),
    INVALID_REQUEST(HttpStatus.BAD_REQUEST, "INVALID_REQUEST", "Invalid Request"),
    ;
    private final String code;
    private final String message;
    private final HttpStatus status;

    ErrorCode(HttpStatus status, String code, String message) {
        this.status = status;
        this.message = message;
        this.code = code;
    }

    public CommonException commonException() {return new CommonException(this);}
}
