package fr.lapetina.liveconfig.domain.reader;

import java.util.Map;

/**
 * Post-merge pass expanding references within a configuration tree.
 */
@FunctionalInterface
public interface Resolver {

    /**
     * Resolves references in place.
     *
     * @throws fr.lapetina.liveconfig.exception.ConfigException if the tree cannot be resolved
     */
    void resolve(Map<String, Object> tree);
}
