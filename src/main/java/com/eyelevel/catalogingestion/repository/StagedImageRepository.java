package com.eyelevel.catalogingestion.repository;

import com.eyelevel.catalogingestion.model.StagedImage;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface StagedImageRepository extends JpaRepository<StagedImage, Long> {

    List<StagedImage> findByProductIdOrderByIdAsc(Long productId);

    List<StagedImage> findByProductIdInOrderByIdAsc(Collection<Long> productIds);

    long countByUploadId(String uploadId);

    @Query(name = "StagedImage.findPathsByProductId")
    List<String> findPathsByProductId(@Param("productId") Long productId);

    @Query(name = "StagedImage.countReferencingPath")
    long countReferencingPath(@Param("path") String path);

    @Modifying
    @Query(name = "StagedImage.deleteByProductId")
    int deleteAllByProductId(@Param("productId") Long productId);

    @Modifying
    @Query(name = "StagedImage.deleteByUploadId")
    int deleteAllByUploadId(@Param("uploadId") String uploadId);
}
