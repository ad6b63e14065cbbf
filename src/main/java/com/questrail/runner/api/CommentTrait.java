package com.questrail.runner.api;

import java.util.List;
import java.util.Objects;

/**
 * Trait carrying nothing but a comment. Never affects scheduling.
 */
public record CommentTrait(String text) implements Trait
{
    public CommentTrait {
        Objects.requireNonNull(text, "text");
    }

    @Override
    public List<String> comments() {
        return List.of(text);
    }
}
