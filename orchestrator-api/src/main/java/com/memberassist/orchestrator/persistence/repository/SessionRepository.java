package com.memberassist.orchestrator.persistence.repository;

import com.memberassist.orchestrator.persistence.entity.SessionEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;

public interface SessionRepository extends JpaRepository<SessionEntity, String> {

    @Modifying
    @Query("delete from SessionEntity s where s.lastAccessedAt < :cutoff")
    int deleteIdleSince(@Param("cutoff") Instant cutoff);
}
