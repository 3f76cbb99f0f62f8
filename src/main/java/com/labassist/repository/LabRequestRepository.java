package com.labassist.repository;

import com.labassist.entity.LabRequest;
import com.labassist.entity.RequestPriority;
import com.labassist.entity.RequestStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Repository interface for managing {@link LabRequest} entities.
 * <p>
 * Status changes go through conditional updates so that a request only moves
 * forward and only one worker can claim it. Each update returns the number of
 * rows changed; zero means the expected source status no longer holds.
 */
public interface LabRequestRepository extends JpaRepository<LabRequest, UUID> {

    default int claim(UUID id, OffsetDateTime now) {
        return markStarted(id, checkedSource(RequestStatus.QUEUED, RequestStatus.RUNNING), RequestStatus.RUNNING, now);
    }

    default int markDone(UUID id, String resultJson, OffsetDateTime now) {
        return markFinished(id, checkedSource(RequestStatus.RUNNING, RequestStatus.DONE), RequestStatus.DONE,
                resultJson, null, now);
    }

    default int markFailed(UUID id, String error, OffsetDateTime now) {
        return markFinished(id, checkedSource(RequestStatus.RUNNING, RequestStatus.FAILED), RequestStatus.FAILED,
                null, error, now);
    }

    default List<UUID> findQueuedIds(Pageable page) {
        return findIdsInPriorityOrder(RequestStatus.QUEUED, RequestPriority.HIGH, page);
    }

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE LabRequest r SET r.status = :to, r.startedAt = :now, r.updatedAt = :now "
            + "WHERE r.id = :id AND r.status = :from")
    int markStarted(@Param("id") UUID id, @Param("from") RequestStatus from,
                    @Param("to") RequestStatus to, @Param("now") OffsetDateTime now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE LabRequest r SET r.status = :to, r.resultJson = :resultJson, r.error = :error, "
            + "r.completedAt = :now, r.updatedAt = :now WHERE r.id = :id AND r.status = :from")
    int markFinished(@Param("id") UUID id, @Param("from") RequestStatus from, @Param("to") RequestStatus to,
                     @Param("resultJson") String resultJson, @Param("error") String error,
                     @Param("now") OffsetDateTime now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE LabRequest r SET r.planJson = :planJson, r.updatedAt = :now "
            + "WHERE r.id = :id AND r.status = com.labassist.entity.RequestStatus.RUNNING")
    int updatePlan(@Param("id") UUID id, @Param("planJson") String planJson, @Param("now") OffsetDateTime now);

    @Query("SELECT r.id FROM LabRequest r WHERE r.status = :status "
            + "ORDER BY CASE WHEN r.priority = :first THEN 0 ELSE 1 END, r.createdAt ASC")
    List<UUID> findIdsInPriorityOrder(@Param("status") RequestStatus status,
                                      @Param("first") RequestPriority first, Pageable page);

    @Query("SELECT r.id FROM LabRequest r WHERE r.status = com.labassist.entity.RequestStatus.RUNNING "
            + "AND r.startedAt < :cutoff")
    List<UUID> findRunningStartedBefore(@Param("cutoff") OffsetDateTime cutoff);

    private static RequestStatus checkedSource(RequestStatus from, RequestStatus to) {
        if (!from.canTransitionTo(to)) {
            throw new IllegalStateException("Illegal request transition " + from + " -> " + to);
        }
        return from;
    }
}
