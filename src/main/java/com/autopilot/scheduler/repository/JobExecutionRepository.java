package com.autopilot.scheduler.repository;

import com.autopilot.scheduler.model.JobExecution;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface JobExecutionRepository extends JpaRepository<JobExecution, UUID> {

    Optional<JobExecution> findFirstByJobIdOrderByFiredAtDesc(String jobId);
}
