package com.llmids.timeline;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record Highlight(String type, String title, String detail) {

    public static Highlight of(String type, String title) {
        return new Highlight(type, title, null);
    }
}
