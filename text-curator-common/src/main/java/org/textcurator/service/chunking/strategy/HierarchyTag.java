package org.textcurator.service.chunking.strategy;

/**
 * Hierarchy data stamped onto chunks of one section.
 *
 * @param firstChunkId id given to the section's first chunk
 * @param level        heading depth, 0 before the first heading
 * @param parentId     first chunk id of the enclosing section, or {@code null}
 * @param title        heading title, or {@code null} for the preamble
 * @param sectionPath  titles from the root joined by {@code /}
 */
record HierarchyTag(String firstChunkId, int level, String parentId, String title, String sectionPath) {
}
