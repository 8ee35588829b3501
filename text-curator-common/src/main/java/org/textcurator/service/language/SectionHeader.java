package org.textcurator.service.language;

/**
 * A heading line recognised by a language profile.
 *
 * @param start offset of the first character of the heading line
 * @param end   offset just past the heading line, excluding the line break
 * @param text  heading title; markdown markers are stripped
 * @param level 1-based heading depth
 */
public record SectionHeader(int start, int end, String text, int level) {
}
