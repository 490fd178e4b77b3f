package com.duelo.engine.parse;

public record WriterDraft(String title, String content) {
}
