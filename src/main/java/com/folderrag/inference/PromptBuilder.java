package com.folderrag.inference;

import java.util.List;

import com.folderrag.ingest.SearchResult;

public class PromptBuilder {
    static final String INSTRUCTION = "Use only the following context from scanned documents to answer the question.";

    /**
     * Builds the grounded prompt. Sources appear in the order given, which callers keep
     * at descending similarity.
     */
    public String build(String question, List<SearchResult> sources) {
        StringBuilder context = new StringBuilder();
        for (SearchResult source : sources) {
            context.append("[Source: ")
                    .append(source.chunk().source())
                    .append("]\n")
                    .append(source.chunk().text())
                    .append("\n\n");
        }

        return INSTRUCTION + "\n\n"
                + "Context:\n"
                + context
                + "\nQuestion: " + question
                + "\n\nAnswer:";
    }
}
