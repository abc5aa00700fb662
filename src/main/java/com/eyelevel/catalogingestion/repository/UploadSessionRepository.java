package com.eyelevel.catalogingestion.repository;

import com.eyelevel.catalogingestion.model.UploadSession;
import com.eyelevel.catalogingestion.model.UploadStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Spring Data JPA repository for the {@link UploadSession} entity.
 * JPQL queries are defined in META-INF/catalog-ingestion-orm.xml.
 */
@Repository
public interface UploadSessionRepository extends JpaRepository<UploadSession, String> {

    List<UploadSession> findByWorkspaceIdOrderByCreatedAtDesc(String workspaceId, Pageable pageable);

    Optional<UploadSession> findFirstByWorkspaceIdAndStatusOrderByCompletedAtDescCreatedAtDesc(String workspaceId,
                                                                                               UploadStatus status);

    /**
     * The most recently completed session of a workspace, i.e. the one a reviewer resumes when no
     * upload id is supplied.
     */
    default Optional<UploadSession> findLatestActive(String workspaceId) {
        return findFirstByWorkspaceIdAndStatusOrderByCompletedAtDescCreatedAtDesc(workspaceId, UploadStatus.COMPLETED);
    }

    List<UploadSession> findByStatusInAndUpdatedAtBefore(Collection<UploadStatus> statuses, LocalDateTime threshold);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query(name = "UploadSession.findByIdForUpdate")
    Optional<UploadSession> findByIdForUpdate(@Param("uploadId") String uploadId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query(name = "UploadSession.transitionStatus")
    int transitionStatus(@Param("uploadId") String uploadId, @Param("newStatus") UploadStatus newStatus,
                         @Param("expectedStatuses") Collection<UploadStatus> expectedStatuses);

    @Query(name = "UploadSession.findExpiredUploadIds")
    List<String> findExpiredUploadIds(@Param("now") LocalDateTime now,
                                      @Param("excludedStatuses") Collection<UploadStatus> excludedStatuses);

    @Query(name = "UploadSession.findStatusesByIds")
    List<Object[]> findStatusesByIds(@Param("uploadIds") Collection<String> uploadIds);
}
