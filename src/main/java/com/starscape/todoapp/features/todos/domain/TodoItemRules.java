package com.starscape.todoapp.features.todos.domain;

import java.util.Optional;

/**
 * Field rules every store applies before writing an item.
 */
public final class TodoItemRules {

    public static final int MAX_TITLE_LENGTH = 500;
    public static final int MAX_DESCRIPTION_LENGTH = 2000;

    private TodoItemRules() {
    }

    /**
     * Titles are stored trimmed.
     */
    public static String normalizeTitle(String title) {
        return title == null ? "" : title.strip();
    }

    /**
     * @param normalizedTitle a title already passed through {@link #normalizeTitle(String)}
     * @return the rejection reason, or empty if the title is acceptable
     */
    public static Optional<String> checkTitle(String normalizedTitle) {
        if (normalizedTitle.isEmpty()) {
            return Optional.of("Title cannot be empty or whitespace-only");
        }
        if (characterCount(normalizedTitle) > MAX_TITLE_LENGTH) {
            return Optional.of("Title cannot exceed " + MAX_TITLE_LENGTH + " characters");
        }
        if (normalizedTitle.chars().anyMatch(Character::isISOControl)) {
            return Optional.of("Title must contain printable characters only");
        }
        return Optional.empty();
    }

    public static Optional<String> checkDescription(String description) {
        if (description != null && characterCount(description) > MAX_DESCRIPTION_LENGTH) {
            return Optional.of("Description cannot exceed " + MAX_DESCRIPTION_LENGTH + " characters");
        }
        return Optional.empty();
    }

    /**
     * Checks the fields of a new item.
     */
    public static Optional<String> checkNew(String title, String description) {
        Optional<String> titleProblem = checkTitle(normalizeTitle(title));
        return titleProblem.isPresent() ? titleProblem : checkDescription(description);
    }

    /**
     * Checks only the fields a patch actually sets.
     */
    public static Optional<String> checkPatch(TodoItemPatch patch) {
        if (patch.title() != null) {
            Optional<String> titleProblem = checkTitle(normalizeTitle(patch.title()));
            if (titleProblem.isPresent()) {
                return titleProblem;
            }
        }
        return checkDescription(patch.description());
    }

    /**
     * Limits count code points, so a character outside the BMP counts once.
     */
    static int characterCount(String value) {
        return value.codePointCount(0, value.length());
    }
}
