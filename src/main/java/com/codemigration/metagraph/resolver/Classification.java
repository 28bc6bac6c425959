package com.codemigration.metagraph.resolver;

import com.codemigration.metagraph.model.entity.ComponentType;
import com.codemigration.metagraph.model.entity.Provenance;

/**
 * @param reason Which rule decided, kept on the Component node for review
 */
public record Classification(ComponentType type, Provenance source, String reason) {

    static Classification syntax(ComponentType type, String reason) {
        return new Classification(type, Provenance.SYNTAX, reason);
    }
}
