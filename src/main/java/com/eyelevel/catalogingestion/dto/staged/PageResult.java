package com.eyelevel.catalogingestion.dto.staged;

import org.springframework.data.domain.Page;

import java.util.Collections;
import java.util.List;
import java.util.function.Function;

/**
 * One page of a staged-data listing. {@code total} is the size of the whole result set so that a
 * client can work out how many further pages to request.
 */
public record PageResult<T>(List<T> items, long total, long offset, int limit) {

    public static <E, T> PageResult<T> of(Page<E> page, Function<E, T> mapper, long offset, int limit) {
        return new PageResult<>(page.getContent().stream().map(mapper).toList(), page.getTotalElements(), offset,
                limit);
    }

    public static <T> PageResult<T> empty(long offset, int limit) {
        return new PageResult<>(Collections.emptyList(), 0, offset, limit);
    }
}
