package io.clusterengine.api.models.responses;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * List response: {@code {"items": [...]}}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ItemsResponse<T> {
    private List<T> items;

    public static <T> ItemsResponse<T> of(List<T> items) {
        return new ItemsResponse<>(items);
    }
}
