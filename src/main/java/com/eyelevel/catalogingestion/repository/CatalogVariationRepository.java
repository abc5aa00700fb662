package com.eyelevel.catalogingestion.repository;

import com.eyelevel.catalogingestion.model.CatalogVariation;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface CatalogVariationRepository extends JpaRepository<CatalogVariation, Long> {

    long countBySourceUploadId(String sourceUploadId);
}
