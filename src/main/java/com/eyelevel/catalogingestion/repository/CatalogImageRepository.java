package com.eyelevel.catalogingestion.repository;

import com.eyelevel.catalogingestion.model.CatalogImage;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface CatalogImageRepository extends JpaRepository<CatalogImage, Long> {

    long countBySourceUploadId(String sourceUploadId);

    @Query(name = "CatalogImage.countReferencingPathPrefix")
    long countReferencingPathPrefix(@Param("prefix") String prefix);
}
