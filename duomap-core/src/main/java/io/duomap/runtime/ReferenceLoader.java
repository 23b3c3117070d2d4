package io.duomap.runtime;

import java.util.Optional;

/**
 * Looks up a related instance by primary key on behalf of a {@link LazyReference}.
 */
@FunctionalInterface
interface ReferenceLoader {

    /**
     * @param fieldName        relationship field being resolved, for error messages
     * @param targetEntityName entity to load
     * @param id               foreign-key value, never null
     * @throws io.duomap.core.UnregisteredTargetException if the target is not registered
     */
    Optional<EntityInstance> load(String fieldName, String targetEntityName, Object id);
}
