package com.folderrag.inference;

import java.util.List;

import com.folderrag.ingest.SearchResult;

public record RagAnswer(String text, List<SearchResult> sources) {
}
