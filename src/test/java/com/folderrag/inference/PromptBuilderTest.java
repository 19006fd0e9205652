package com.folderrag.inference;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.folderrag.ingest.DocumentChunk;
import com.folderrag.ingest.SearchResult;

class PromptBuilderTest {

    @Test
    void shouldBuildGroundedPromptWithAttributedSources() {
        List<SearchResult> sources = List.of(
                new SearchResult(new DocumentChunk(new float[] { 1f }, "Invoices are due in 30 days.", "terms.md"), 0.9f),
                new SearchResult(new DocumentChunk(new float[] { 1f }, "Late fees apply.", "fees.txt"), 0.4f));

        String prompt = new PromptBuilder().build("When are invoices due?", sources);

        assertEquals("""
                Use only the following context from scanned documents to answer the question.

                Context:
                [Source: terms.md]
                Invoices are due in 30 days.

                [Source: fees.txt]
                Late fees apply.


                Question: When are invoices due?

                Answer:""", prompt);
    }

    @Test
    void shouldStillAskTheQuestionWithoutSources() {
        String prompt = new PromptBuilder().build("Anything?", List.of());

        assertEquals(PromptBuilder.INSTRUCTION + "\n\nContext:\n\nQuestion: Anything?\n\nAnswer:", prompt);
    }
}
