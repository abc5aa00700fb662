package com.eyelevel.catalogingestion.dto.cleanup;

import lombok.Data;

@Data
public class OrphanSweepStats {
    private int uploadsScanned;
    private int imagesScanned;
    private int orphanedDeleted;
    private int errors;
}
