package com.autobulk;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface JobExecutionRepository extends JpaRepository<JobExecution, UUID> {

    List<JobExecution> findByJobIdOrderByCreatedAtDescAttemptDesc(UUID jobId, Pageable pageable);

    List<JobExecution> findByJobIdAndStatus(UUID jobId, ExecutionStatus status);
}
