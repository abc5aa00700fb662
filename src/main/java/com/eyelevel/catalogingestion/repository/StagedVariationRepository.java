package com.eyelevel.catalogingestion.repository;

import com.eyelevel.catalogingestion.model.StagedVariation;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface StagedVariationRepository extends JpaRepository<StagedVariation, Long> {

    List<StagedVariation> findByProductIdOrderByIdAsc(Long productId);

    List<StagedVariation> findByProductIdInOrderByIdAsc(Collection<Long> productIds);

    long countByUploadId(String uploadId);

    @Modifying
    @Query(name = "StagedVariation.deleteByProductId")
    int deleteAllByProductId(@Param("productId") Long productId);

    @Modifying
    @Query(name = "StagedVariation.deleteByUploadId")
    int deleteAllByUploadId(@Param("uploadId") String uploadId);
}
