package com.platform.drengine.persistence.repository;

import com.platform.drengine.persistence.entity.BackupJobEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

/**
 * Spring Data JPA repository for backup jobs.
 */
@Repository
public interface BackupJobJpaRepository extends JpaRepository<BackupJobEntity, String> {
    
    List<BackupJobEntity> findByActiveTrue();
    
    @Modifying
    @Query("UPDATE BackupJobEntity j SET j.nextExecution = :next, j.version = j.version + 1 WHERE j.id = :id")
    int updateNextExecution(@Param("id") String id, @Param("next") Instant next);
    
    @Modifying
    @Query("UPDATE BackupJobEntity j SET j.statsJson = :stats, j.version = j.version + 1 WHERE j.id = :id")
    int updateStats(@Param("id") String id, @Param("stats") String statsJson);
    
    @Modifying
    @Query("UPDATE BackupJobEntity j SET j.active = false, j.version = j.version + 1 WHERE j.id = :id")
    int deactivate(@Param("id") String id);
}
