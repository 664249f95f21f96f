package com.autobulk;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import jakarta.persistence.QueryHint;
import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface JobRepository extends JpaRepository<Job, UUID> {

    /**
     * Number of jobs currently in one status, fetched by a single grouped query.
     */
    interface StatusCount {
        JobStatus getStatus();

        Long getTotal();
    }

    @Query("""
            SELECT j FROM Job j
            WHERE j.cancelled = false
              AND j.nextRunAt IS NOT NULL
              AND j.nextRunAt <= :now
              AND j.status IN :statuses
            ORDER BY j.nextRunAt ASC
            """)
    @QueryHints(@QueryHint(name = "org.hibernate.readOnly", value = "true"))
    List<Job> findDueJobs(@Param("now") OffsetDateTime now, @Param("statuses") Collection<JobStatus> statuses);

    /**
     * Compare-and-set claim: moves a schedulable, non-cancelled job to {@code running}.
     *
     * @return 1 when this caller won the claim, 0 otherwise
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            UPDATE Job j
            SET j.status = :running,
                j.lastError = NULL,
                j.updatedAt = :now
            WHERE j.id = :id
              AND j.cancelled = false
              AND j.status IN :claimable
            """)
    int claim(
            @Param("id") UUID id,
            @Param("running") JobStatus running,
            @Param("claimable") Collection<JobStatus> claimable,
            @Param("now") OffsetDateTime now);

    /**
     * Guarded release of a job stuck in {@code running}: matches only while the job is still
     * running and untouched since {@code cutoff}, so a job finalized in the meantime is left alone.
     *
     * @return 1 when the job was released by this caller, 0 otherwise
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            UPDATE Job j
            SET j.updatedAt = :now
            WHERE j.id = :id
              AND j.status = :running
              AND j.updatedAt < :cutoff
            """)
    int releaseStale(
            @Param("id") UUID id,
            @Param("running") JobStatus running,
            @Param("cutoff") OffsetDateTime cutoff,
            @Param("now") OffsetDateTime now);

    @QueryHints(@QueryHint(name = "org.hibernate.readOnly", value = "true"))
    List<Job> findAllByOrderByCreatedAtDesc();

    List<Job> findByStatusAndUpdatedAtBefore(JobStatus status, OffsetDateTime cutoff);

    @Query("SELECT j.status AS status, COUNT(j) AS total FROM Job j GROUP BY j.status")
    List<StatusCount> countByStatus();
}
