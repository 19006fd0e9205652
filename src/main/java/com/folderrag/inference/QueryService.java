package com.folderrag.inference;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.folderrag.error.InvalidConfigurationException;
import com.folderrag.ingest.EmbeddingService;
import com.folderrag.ingest.SearchResult;
import com.folderrag.ingest.VectorIndex;
import com.folderrag.runtime.CancellationToken;

/**
 * Answers a question from the indexed documents: embed, retrieve top-K, prompt, generate.
 */
public class QueryService {
    private static final Logger log = LoggerFactory.getLogger(QueryService.class);
    public static final String NO_DOCUMENTS_MESSAGE = "No documents have been indexed yet. Please index your documents first.";
    public static final int DEFAULT_TOP_K = 3;

    private final VectorIndex index;
    private final EmbeddingService embeddingService;
    private final GenerationService generationService;
    private final PromptBuilder promptBuilder;

    public QueryService(VectorIndex index, EmbeddingService embeddingService, GenerationService generationService) {
        this(index, embeddingService, generationService, new PromptBuilder());
    }

    public QueryService(VectorIndex index,
            EmbeddingService embeddingService,
            GenerationService generationService,
            PromptBuilder promptBuilder) {
        this.index = index;
        this.embeddingService = embeddingService;
        this.generationService = generationService;
        this.promptBuilder = promptBuilder;
    }

    public String answer(String question, String llmModel, String embeddingModel) {
        return answer(question, llmModel, embeddingModel, DEFAULT_TOP_K);
    }

    public String answer(String question, String llmModel, String embeddingModel, int topK) {
        return ask(question, llmModel, embeddingModel, topK, CancellationToken.none()).text();
    }

    public RagAnswer ask(String question,
            String llmModel,
            String embeddingModel,
            int topK,
            CancellationToken cancellation) {
        if (index.isEmpty()) {
            return new RagAnswer(NO_DOCUMENTS_MESSAGE, List.of());
        }
        if (topK < 1) {
            throw new InvalidConfigurationException("topK must be at least 1 but was " + topK);
        }

        cancellation.throwIfCancelled("query");
        float[] questionEmbedding = embeddingService.embed(question, embeddingModel, cancellation);
        List<SearchResult> sources = index.search(questionEmbedding, topK);
        if (log.isDebugEnabled()) {
            log.debug("query.retrieved topK={} hits={} sources={}", topK, sources.size(),
                    sources.stream().map(hit -> hit.chunk().source() + "@" + String.format("%.4f", hit.score())).toList());
        }

        String prompt = promptBuilder.build(question, sources);
        cancellation.throwIfCancelled("query");
        String text = generationService.generate(llmModel, prompt, cancellation);
        return new RagAnswer(text, sources);
    }
}
