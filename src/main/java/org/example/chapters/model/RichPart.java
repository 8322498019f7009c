package org.example.chapters.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * One entry of an ordered text/image sequence such as a question body,
 * a choice's content or an analysis block.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = TextSegment.class, name = "text"),
    @JsonSubTypes.Type(value = ImageRef.class, name = "image")
})
public interface RichPart {
}
