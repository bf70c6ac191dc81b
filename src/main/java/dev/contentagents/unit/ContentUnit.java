package dev.contentagents.unit;

import java.util.Optional;

/**
 * The units of the content pipeline. Each variant carries its dependency list and its
 * transition function; the scheduler only sees {@link Unit}.
 */
public sealed interface ContentUnit extends Unit
    permits ParserUnit, QuestionsUnit, ProductUnit, ComparisonUnit, FaqUnit {

    /** File name the caller persists this unit's output under, if it is a published page. */
    default Optional<String> artifactFile() {
        return Optional.empty();
    }
}
