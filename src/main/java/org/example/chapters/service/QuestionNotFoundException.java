package org.example.chapters.service;

import java.util.List;

public class QuestionNotFoundException extends RuntimeException {

    private final List<String> availableNumbers;

    public QuestionNotFoundException(String message, List<String> availableNumbers) {
        super(message);
        this.availableNumbers = List.copyOf(availableNumbers);
    }

    public List<String> availableNumbers() {
        return availableNumbers;
    }
}
