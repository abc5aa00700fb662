package com.eyelevel.catalogingestion.dto.cleanup;

import lombok.Data;

@Data
public class ExpiredSweepStats {
    private int uploadsDeleted;
    private int familiesDeleted;
    private int productsDeleted;
    private int variationsDeleted;
    private int imagesDeleted;
    private int filesDeleted;
    private int errors;

    public void add(ExpiredSweepStats other) {
        uploadsDeleted += other.uploadsDeleted;
        familiesDeleted += other.familiesDeleted;
        productsDeleted += other.productsDeleted;
        variationsDeleted += other.variationsDeleted;
        imagesDeleted += other.imagesDeleted;
        filesDeleted += other.filesDeleted;
        errors += other.errors;
    }
}
