package org.example.chapters.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = HeadingItem.class, name = "heading"),
    @JsonSubTypes.Type(value = TextItem.class, name = "text"),
    @JsonSubTypes.Type(value = ImageItem.class, name = "image"),
    @JsonSubTypes.Type(value = QuestionItem.class, name = "qa")
})
public interface ChapterItem {
}
