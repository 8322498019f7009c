package org.example.chapters.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record QuestionItem(
    String number,
    String question,
    @JsonProperty("question_rich") List<RichPart> questionRich,
    List<Choice> choices,
    @JsonProperty("answer_lines") List<String> answerLines,
    String answer,
    @JsonProperty("analysis_lines") List<RichPart> analysisLines,
    String analysis,
    @JsonProperty("question_extra") List<RichPart> questionExtra,
    List<ImageUsage> images
) implements ChapterItem {

    public QuestionItem withImages(List<ImageUsage> usages) {
        return new QuestionItem(number, question, questionRich, choices, answerLines, answer,
            analysisLines, analysis, questionExtra, List.copyOf(usages));
    }
}
