package com.eyelevel.catalogingestion.repository;

import com.eyelevel.catalogingestion.model.ImportStatus;
import com.eyelevel.catalogingestion.model.StagedProduct;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface StagedProductRepository extends JpaRepository<StagedProduct, Long> {

    Page<StagedProduct> findByUploadIdAndImportStatusNot(String uploadId, ImportStatus excluded, Pageable pageable);

    Page<StagedProduct> findByUploadIdAndFamilyIdAndImportStatusNot(String uploadId, Long familyId,
                                                                    ImportStatus excluded, Pageable pageable);

    List<StagedProduct> findByUploadIdAndImportStatusNotOrderByIdAsc(String uploadId, ImportStatus excluded);

    long countByUploadId(String uploadId);

    @Modifying
    @Query(name = "StagedProduct.markImportedByUploadId")
    int markImportedByUploadId(@Param("uploadId") String uploadId, @Param("newStatus") ImportStatus newStatus,
                               @Param("excluded") ImportStatus excluded);

    @Modifying
    @Query(name = "StagedProduct.deleteByUploadId")
    int deleteAllByUploadId(@Param("uploadId") String uploadId);
}
