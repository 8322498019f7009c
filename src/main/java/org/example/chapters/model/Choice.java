package org.example.chapters.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record Choice(
    String label,
    List<RichPart> content
) {

    @JsonProperty("images")
    public List<ImageRef> images() {
        return content.stream()
            .filter(ImageRef.class::isInstance)
            .map(ImageRef.class::cast)
            .toList();
    }
}
