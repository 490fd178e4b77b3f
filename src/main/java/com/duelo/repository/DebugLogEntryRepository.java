package com.duelo.repository;

import com.duelo.entity.AgentType;
import com.duelo.entity.DebugLogEntry;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

/**
 * Repository interface for managing {@link DebugLogEntry} entities.
 */
public interface DebugLogEntryRepository extends JpaRepository<DebugLogEntry, Long> {

    List<DebugLogEntry> findByOperationTypeOrderByIdDesc(AgentType operationType, Pageable pageable);

    long countByOperationType(AgentType operationType);

    @Query("select e.id from DebugLogEntry e where e.operationType = :type order by e.id desc")
    List<Long> findIdsNewestFirst(@Param("type") AgentType type, Pageable pageable);
}
