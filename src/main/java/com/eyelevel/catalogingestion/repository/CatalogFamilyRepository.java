package com.eyelevel.catalogingestion.repository;

import com.eyelevel.catalogingestion.model.CatalogFamily;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface CatalogFamilyRepository extends JpaRepository<CatalogFamily, Long> {

    long countBySourceUploadId(String sourceUploadId);
}
