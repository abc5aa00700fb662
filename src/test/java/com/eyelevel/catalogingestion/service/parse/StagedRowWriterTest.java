package com.eyelevel.catalogingestion.service.parse;

import com.eyelevel.catalogingestion.model.ImageRole;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class StagedRowWriterTest {

    @Test
    void splitsImagesEvenlyAndGivesRemainderToLastProduct() {
        List<List<Integer>> split = StagedRowWriter.distributeImages(5, 2);

        assertThat(split).containsExactly(List.of(0, 1), List.of(2, 3, 4));
    }

    @Test
    void givesOneImagePerProductWhileImagesLast() {
        List<List<Integer>> split = StagedRowWriter.distributeImages(2, 3);

        assertThat(split).containsExactly(List.of(0), List.of(1), List.of());
    }

    @Test
    void productsWithoutImagesGetEmptyLists() {
        assertThat(StagedRowWriter.distributeImages(0, 2)).containsExactly(List.of(), List.of());
    }

    @Test
    void assignsPrimaryHoverAndGalleryRoles() {
        assertThat(StagedRowWriter.rolesFor(0, 3)).containsExactlyInAnyOrder(ImageRole.PRIMARY, ImageRole.GALLERY);
        assertThat(StagedRowWriter.rolesFor(1, 3)).containsExactlyInAnyOrder(ImageRole.HOVER, ImageRole.GALLERY);
        assertThat(StagedRowWriter.rolesFor(2, 3)).containsExactly(ImageRole.GALLERY);
    }

    @Test
    void loneImageServesEveryRole() {
        assertThat(StagedRowWriter.rolesFor(0, 1)).containsExactlyInAnyOrder(ImageRole.PRIMARY, ImageRole.HOVER,
                                                                             ImageRole.GALLERY);
    }
}
