package io.clusterengine.api.models.responses;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of a synchronous create: the new entity's id and where to read it.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ResourceResponse {
    private String id;
    private String location;
}
