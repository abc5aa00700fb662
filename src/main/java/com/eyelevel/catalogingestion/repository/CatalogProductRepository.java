package com.eyelevel.catalogingestion.repository;

import com.eyelevel.catalogingestion.model.CatalogProduct;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface CatalogProductRepository extends JpaRepository<CatalogProduct, Long> {

    List<CatalogProduct> findBySourceUploadIdOrderByIdAsc(String sourceUploadId);

    long countBySourceUploadId(String sourceUploadId);
}
