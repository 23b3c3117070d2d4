package io.duomap.core;

/**
 * Storage-only field holding the identifier of a related entity.
 *
 * @param name              always {@code {relationshipField}_id}
 * @param relationshipField the to-one relationship the key belongs to
 * @param targetEntityName  entity whose primary key the value refers to
 * @param nullable          mirrors the relationship's optionality
 */
public record SynthesizedForeignKey(String name, String relationshipField, String targetEntityName, boolean nullable) {
}
