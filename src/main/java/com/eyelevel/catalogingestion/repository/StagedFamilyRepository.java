package com.eyelevel.catalogingestion.repository;

import com.eyelevel.catalogingestion.model.ImportStatus;
import com.eyelevel.catalogingestion.model.StagedFamily;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface StagedFamilyRepository extends JpaRepository<StagedFamily, Long> {

    Page<StagedFamily> findByUploadIdAndImportStatusNot(String uploadId, ImportStatus excluded, Pageable pageable);

    List<StagedFamily> findByUploadIdOrderByIdAsc(String uploadId);

    long countByUploadId(String uploadId);

    @Modifying
    @Query(name = "StagedFamily.markImportedByUploadId")
    int markImportedByUploadId(@Param("uploadId") String uploadId, @Param("newStatus") ImportStatus newStatus);

    @Modifying
    @Query(name = "StagedFamily.deleteByUploadId")
    int deleteAllByUploadId(@Param("uploadId") String uploadId);
}
