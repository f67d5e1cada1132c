package com.example.monsterbattle.battle.catalog;

import java.util.List;
import java.util.Optional;

import com.example.monsterbattle.battle.domain.Skill;

/**
 * 스킬 데이터 조회 인터페이스
 */
public interface SkillCatalog {

    /**
     * 스킬 ID로 조회
     *
     * @param skillId 스킬 ID
     * @return 없으면 empty
     */
    Optional<Skill> lookup(String skillId);

    /**
     * 등록된 전체 스킬 (등록 순서 유지)
     */
    List<Skill> findAll();
}
