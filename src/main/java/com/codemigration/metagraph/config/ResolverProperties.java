package com.codemigration.metagraph.config;

import jakarta.validation.constraints.Min;
import lombok.Data;

@Data
public class ResolverProperties {

    /**
     * Hop bound of the closure stored for reporting; the planning closure is unbounded.
     */
    @Min(1)
    private int reportClosureDepth = 3;
}
