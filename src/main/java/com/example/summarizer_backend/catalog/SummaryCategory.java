package com.example.summarizer_backend.catalog;

import java.util.List;

/**
 * Fixed catalog of categories a summary can be requested for. Each category is matched through one or
 * more CLIP prompt templates so callers never have to author prose.
 */
public enum SummaryCategory {
    ACTION("action", "Action",
            "Fast movement, fights, chases, sports and other high-energy moments",
            List.of("a photo of people running or fighting",
                    "a fast action scene with motion blur",
                    "a sports moment with players in motion")),
    DIALOGUE("dialogue", "Dialogue",
            "People talking to each other or addressing the camera",
            List.of("a photo of two people having a conversation",
                    "a person talking to the camera",
                    "a close-up of a person speaking")),
    LANDSCAPE("landscape", "Landscape",
            "Scenic outdoor views such as mountains, sea, sky and cityscapes",
            List.of("a photo of a beautiful landscape",
                    "a scenic view of mountains or the sea",
                    "a wide shot of a city skyline")),
    PEOPLE("people", "People",
            "Shots where people are the main subject",
            List.of("a photo of a group of people",
                    "a portrait of a person",
                    "people walking together")),
    TEXT("text", "Text",
            "Slides, titles, captions and other on-screen text",
            List.of("a slide with text on it",
                    "a title card with large letters",
                    "a screenshot of a document")),
    KEY_MOMENTS("key_moments", "Key Moments",
            "Visually striking or emotionally important moments",
            List.of("an important dramatic moment",
                    "a celebration with people cheering",
                    "a surprising moment captured on video"));

    private final String id;
    private final String displayName;
    private final String description;
    private final List<String> promptTemplates;

    SummaryCategory(String id, String displayName, String description, List<String> promptTemplates) {
        this.id = id;
        this.displayName = displayName;
        this.description = description;
        this.promptTemplates = promptTemplates;
    }

    public String id() {
        return id;
    }

    public String displayName() {
        return displayName;
    }

    public String description() {
        return description;
    }

    public List<String> promptTemplates() {
        return promptTemplates;
    }
}
