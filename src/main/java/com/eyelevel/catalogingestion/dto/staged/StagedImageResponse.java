package com.eyelevel.catalogingestion.dto.staged;

import com.eyelevel.catalogingestion.model.ImageRole;
import com.eyelevel.catalogingestion.model.StagedImage;

import java.util.Set;

public record StagedImageResponse(
        Long id,
        Long productId,
        String path,
        Integer width,
        Integer height,
        Integer sourcePage,
        Set<ImageRole> roles) {

    public static StagedImageResponse from(StagedImage image) {
        return new StagedImageResponse(image.getId(), image.getProductId(), image.getPath(), image.getWidth(),
                image.getHeight(), image.getSourcePage(), Set.copyOf(image.getRoles()));
    }
}
