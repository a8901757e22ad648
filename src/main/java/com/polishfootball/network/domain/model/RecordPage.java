package com.polishfootball.network.domain.model;

import java.util.List;

/**
 * One page of records as returned by the backing store, with the unpaged total.
 */
public record RecordPage<T>(List<T> records, long totalCount) {

    public static <T> RecordPage<T> empty() {
        return new RecordPage<>(List.of(), 0);
    }
}
