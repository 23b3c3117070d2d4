package io.duomap.runtime;

/**
 * Implemented by every generated view; gives access to the backing instance.
 */
public interface EntityView {

    EntityInstance entityInstance();
}
